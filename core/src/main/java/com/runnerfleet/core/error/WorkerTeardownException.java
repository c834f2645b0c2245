package com.runnerfleet.core.error;

import lombok.Getter;

/**
 * Destroying a worker finished with at least one failed step.
 * <p>
 * Both the deregistration and the compute destruction are always attempted; their
 * failures are attached as suppressed exceptions. The worker is removed from the tracked
 * set regardless.
 * </p>
 */
@Getter
public class WorkerTeardownException extends ProvisioningException {
    private final String workerName;

    public WorkerTeardownException(String workerName, Throwable first) {
        super("Teardown of worker " + workerName + " incomplete: " + first.getMessage(), first);
        this.workerName = workerName;
    }
}
