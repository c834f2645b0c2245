package com.runnerfleet.core.error;

/**
 * Removing a worker registration failed. Best-effort: never blocks compute cleanup.
 */
public class WorkerDeregistrationException extends ProvisioningException {
    public WorkerDeregistrationException(String message) {
        super(message);
    }

    public WorkerDeregistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
