package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.QueueMetrics;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of one fleet, replaced after every command the fleet's loop processes.
 */
@Value
@Builder(toBuilder = true)
public class FleetStatus {
    String fleet;
    String repository;
    List<String> labels;
    ScalingConfig scaling;

    /**
     * Workers in provisioning, registered, active or draining state.
     */
    List<EphemeralWorker> workers;

    int trackedWorkers;
    int activeWorkers;
    ScalingDecision lastDecision;
    Instant lastActionTime;

    /**
     * Queue snapshot of the last successful observation, for diagnostics only.
     */
    QueueMetrics previousMetrics;

    boolean degraded;
    int consecutiveFailedRounds;
    String lastError;

    /**
     * Set once the fleet is being disabled.
     */
    boolean stopping;
}
