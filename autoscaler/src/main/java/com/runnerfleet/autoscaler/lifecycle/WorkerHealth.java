package com.runnerfleet.autoscaler.lifecycle;

import com.runnerfleet.core.model.WorkerInfo;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of asking the provider about one worker.
 * <p>
 * {@code GONE} means the provider dropped the worker or reports it offline.
 * {@code UNKNOWN} means the lookup itself failed, so nothing is known about it.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WorkerHealth {
    public enum State { ONLINE, GONE, UNKNOWN }

    State state;
    WorkerInfo info;
    Throwable error;

    static WorkerHealth of(WorkerInfo info) {
        return new WorkerHealth(info.isOnline() ? State.ONLINE : State.GONE, info, null);
    }

    static WorkerHealth gone() {
        return new WorkerHealth(State.GONE, null, null);
    }

    static WorkerHealth unknown(Throwable error) {
        return new WorkerHealth(State.UNKNOWN, null, error);
    }

    public boolean isHealthy() {
        return state == State.ONLINE;
    }

    public boolean isGone() {
        return state == State.GONE;
    }

    public boolean isUnknown() {
        return state == State.UNKNOWN;
    }

    /** Whether the provider reports the worker running a job; {@code false} unless online. */
    public boolean isBusy() {
        return info != null && info.isOnline() && info.isBusy();
    }
}
