package com.runnerfleet.core.msg;

import com.runnerfleet.core.model.ScalingDecision;
import com.runnerfleet.core.model.WorkerStatus;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Control events published by the autoscaler.
 * <p>
 * These messages flow over Kafka so dashboards, audit sinks and chat-ops bots can follow
 * what the fleets are doing without polling the operator API.
 * </p>
 */
public final class ControlMessages {
    private ControlMessages() {
    }

    /**
     * Published when a fleet dispatches a scale-up or scale-down.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    public static class ScaleSignal {
        String fleet;
        ScalingDecision decision;

        /**
         * Whether the action was requested by an operator instead of the policy.
         */
        boolean manual;

        long ts;
    }

    /**
     * Published on every worker lifecycle transition.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    public static class WorkerEvent {
        String fleet;
        String workerName;
        Long workerId;
        WorkerStatus status;
        long ts;
    }

    /**
     * Published when a fleet's provisioning rounds keep failing.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    public static class FleetDegraded {
        String fleet;
        int consecutiveFailedRounds;
        String lastError;
        long ts;
    }
}
