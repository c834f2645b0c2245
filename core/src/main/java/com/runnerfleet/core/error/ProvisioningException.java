package com.runnerfleet.core.error;

/**
 * Base class of every failure raised while observing the queue or managing a worker's lifecycle.
 */
public class ProvisioningException extends RuntimeException {
    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
