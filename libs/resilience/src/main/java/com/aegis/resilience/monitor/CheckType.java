package com.aegis.resilience.monitor;

/**
 * How a service's health is probed.
 */
public enum CheckType {
    PING,
    HTTP,
    RESOURCE,
    CUSTOM
}
