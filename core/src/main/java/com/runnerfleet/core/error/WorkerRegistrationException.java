package com.runnerfleet.core.error;

/**
 * Binding a worker to the provider failed after a token was obtained. Triggers destruction of the compute instance.
 */
public class WorkerRegistrationException extends ProvisioningException {
    public WorkerRegistrationException(String message) {
        super(message);
    }

    public WorkerRegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
