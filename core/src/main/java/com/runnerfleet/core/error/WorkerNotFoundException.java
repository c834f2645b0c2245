package com.runnerfleet.core.error;

import lombok.Getter;

/**
 * The provider does not know the given worker id.
 */
@Getter
public class WorkerNotFoundException extends ProvisioningException {
    private final long workerId;

    public WorkerNotFoundException(long workerId) {
        super("Worker " + workerId + " not found");
        this.workerId = workerId;
    }
}
