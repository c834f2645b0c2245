package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;

/**
 * The fleet's unit of lifecycle ownership: one compute instance plus the worker
 * registration running on it.
 * <p>
 * Instances are immutable snapshots; every lifecycle step produces a new snapshot via
 * {@link #transitionTo(WorkerStatus)}. The compute instance and the registration are
 * destroyed together.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class EphemeralWorker {
    /**
     * Worker name, also used as the compute instance name and the provider runner name.
     */
    String name;

    String fleetName;

    /**
     * Compute instance, {@code null} until the provisioner has created it.
     */
    ComputeHandle compute;

    /**
     * Provider-assigned worker id, {@code null} until registered.
     */
    Long workerId;

    Instant createdAt;

    /**
     * Monotonically increasing count of jobs this worker finished.
     */
    int jobsCompleted;

    /**
     * Whether the provider last reported this worker as busy.
     */
    boolean busy;

    WorkerStatus status;

    public EphemeralWorker transitionTo(WorkerStatus next) {
        if (status == next) {
            return this;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Worker %s cannot move from %s to %s", name, status, next));
        }
        return withStatus(next);
    }

    public EphemeralWorker recordJobCompleted() {
        return withJobsCompleted(jobsCompleted + 1);
    }

    public boolean isRegistered() {
        return workerId != null;
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }
}
