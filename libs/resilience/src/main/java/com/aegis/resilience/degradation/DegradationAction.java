package com.aegis.resilience.degradation;

/**
 * A custom degradation or recovery action.
 * <p>
 * Actions run on the thread reporting the event while the controller's state is locked.
 * They may query the controller but should not block.
 */
@FunctionalInterface
public interface DegradationAction {

    /**
     * @param serviceName the service whose failure or recovery triggered the action
     */
    void execute(String serviceName);
}
