package com.runnerfleet.core.error;

/**
 * Registration token fetch failed. Retried on the next tick, never within the same attempt.
 */
public class RegistrationTokenException extends ProvisioningException {
    public RegistrationTokenException(String message) {
        super(message);
    }

    public RegistrationTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
