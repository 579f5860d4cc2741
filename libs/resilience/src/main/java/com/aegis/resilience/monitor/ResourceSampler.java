package com.aegis.resilience.monitor;

/**
 * Source of resource readings for health metrics and resource checks.
 */
@FunctionalInterface
public interface ResourceSampler {

    ResourceUsage sample();
}
