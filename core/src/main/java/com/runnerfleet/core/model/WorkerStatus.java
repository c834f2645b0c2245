package com.runnerfleet.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an ephemeral worker.
 * <pre>
 *   PROVISIONING -> REGISTERED -> ACTIVE -> DRAINING -> DESTROYED
 * </pre>
 * Every non-terminal state may also fall through to {@code DRAINING} or {@code DESTROYED}
 * when a compensating cleanup runs.
 */
public enum WorkerStatus {
    PROVISIONING,
    REGISTERED,
    ACTIVE,
    DRAINING,
    DESTROYED;

    public boolean canTransitionTo(WorkerStatus next) {
        return allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == DESTROYED;
    }

    private Set<WorkerStatus> allowedNext() {
        switch (this) {
            case PROVISIONING:
                return EnumSet.of(REGISTERED, DRAINING, DESTROYED);
            case REGISTERED:
                return EnumSet.of(ACTIVE, DRAINING, DESTROYED);
            case ACTIVE:
                return EnumSet.of(DRAINING, DESTROYED);
            case DRAINING:
                return EnumSet.of(DESTROYED);
            default:
                return EnumSet.noneOf(WorkerStatus.class);
        }
    }
}
