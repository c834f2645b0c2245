package com.runnerfleet.autoscaler.lifecycle;

import com.runnerfleet.core.model.EphemeralWorker;

/**
 * Receives every worker snapshot produced by a lifecycle operation, in order.
 * A snapshot in {@code DESTROYED} means the worker must leave the tracked set.
 */
@FunctionalInterface
public interface WorkerTransitionListener {
    WorkerTransitionListener NONE = worker -> { };

    void onTransition(EphemeralWorker worker);
}
