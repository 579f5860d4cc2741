package com.aegis.resilience.recovery;

/**
 * Observer of service failures and recoveries handled by the {@link ErrorRecoveryManager}.
 * Called outside the manager's lock, on the thread that reported the event.
 */
public interface ServiceEventListener {

    /** A failure was reported for the service. */
    void onServiceFailure(String serviceName, Throwable error);

    /** The service returned to {@link ServiceStatus#HEALTHY}. */
    void onServiceRecovered(String serviceName);
}
