package com.aegis.resilience.degradation;

import java.util.List;

/**
 * Escalates the degradation level and runs named actions when its trigger matches.
 *
 * @param triggerCondition when the rule applies
 * @param degradationLevel level the system escalates to (never lowered by a rule)
 * @param actions          names of the actions to run, in order
 * @param priority         evaluation order, lower first
 */
public record DegradationRule(
        TriggerCondition triggerCondition,
        DegradationLevel degradationLevel,
        List<String> actions,
        int priority
) {

    public DegradationRule {
        if (triggerCondition == null) {
            throw new IllegalArgumentException("triggerCondition must not be null");
        }
        if (degradationLevel == null) {
            throw new IllegalArgumentException("degradationLevel must not be null");
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /** The rules every controller starts with. */
    public static List<DegradationRule> defaults() {
        return List.of(
                new DegradationRule(TriggerCondition.ESSENTIAL_SERVICE_FAILED, DegradationLevel.SEVERE,
                        List.of(DegradationActions.ACTIVATE_EMERGENCY_MODE, DegradationActions.NOTIFY_ADMINISTRATORS), 1),
                new DegradationRule(TriggerCondition.MULTIPLE_SERVICES_FAILED, DegradationLevel.MODERATE,
                        List.of(DegradationActions.ACTIVATE_FALLBACKS, DegradationActions.DISABLE_NON_ESSENTIAL_FEATURES), 2),
                new DegradationRule(TriggerCondition.OPTIONAL_SERVICE_FAILED, DegradationLevel.MINOR,
                        List.of(DegradationActions.ACTIVATE_FALLBACK, DegradationActions.LOG_DEGRADATION), 3));
    }
}
