package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.QueueMetrics;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;
import com.runnerfleet.core.model.WorkerStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Mutable state of one fleet. Not thread-safe: only the fleet's loop touches it.
 */
class FleetState {
    final FleetConfig fleet;
    ScalingConfig scaling;

    // worker name -> latest snapshot; destroyed workers are removed
    private final Map<String, EphemeralWorker> workers = new LinkedHashMap<>();

    Instant lastActionTime;
    ScalingDecision lastDecision;
    QueueMetrics previousMetrics;

    int consecutiveFailedRounds;
    boolean degraded;
    String lastError;

    FleetState(FleetConfig fleet, ScalingConfig scaling) {
        this.fleet = fleet;
        this.scaling = scaling;
    }

    void apply(EphemeralWorker worker) {
        if (worker.getStatus() == WorkerStatus.DESTROYED) {
            workers.remove(worker.getName());
        } else {
            workers.put(worker.getName(), worker);
        }
    }

    Optional<EphemeralWorker> worker(String name) {
        return Optional.ofNullable(workers.get(name));
    }

    List<EphemeralWorker> tracked() {
        return new ArrayList<>(workers.values());
    }

    List<EphemeralWorker> active() {
        return workers.values().stream()
            .filter(w -> w.getStatus() == WorkerStatus.ACTIVE)
            .collect(Collectors.toList());
    }

    int activeCount() {
        return (int) workers.values().stream().filter(w -> w.getStatus() == WorkerStatus.ACTIVE).count();
    }

    FleetStatus snapshot(boolean stopping) {
        return FleetStatus.builder()
            .fleet(fleet.getName())
            .repository(fleet.getRepository())
            .labels(fleet.getLabels())
            .scaling(scaling)
            .workers(List.copyOf(workers.values()))
            .trackedWorkers(workers.size())
            .activeWorkers(activeCount())
            .lastDecision(lastDecision)
            .lastActionTime(lastActionTime)
            .previousMetrics(previousMetrics)
            .degraded(degraded)
            .consecutiveFailedRounds(consecutiveFailedRounds)
            .lastError(lastError)
            .stopping(stopping)
            .build();
    }
}
