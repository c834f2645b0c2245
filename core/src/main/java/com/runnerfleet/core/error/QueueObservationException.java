package com.runnerfleet.core.error;

/**
 * Queue metrics could not be fetched. The tick makes no decision.
 */
public class QueueObservationException extends ProvisioningException {
    public QueueObservationException(String message) {
        super(message);
    }

    public QueueObservationException(String message, Throwable cause) {
        super(message, cause);
    }
}
