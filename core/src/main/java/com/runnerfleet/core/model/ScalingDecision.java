package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Result of a single policy evaluation, produced and consumed within one tick.
 */
@Value
@Builder(toBuilder = true)
@With
public class ScalingDecision {
    ScalingAction action;

    /**
     * Runner count the fleet should converge to.
     */
    int targetRunnerCount;

    /**
     * Runner count the decision was made against.
     */
    int currentRunnerCount;

    /**
     * Human-readable reason for this decision.
     */
    String reason;

    /**
     * Number of runners to add (positive) or remove (negative).
     */
    public int delta() {
        return action == ScalingAction.MAINTAIN ? 0 : targetRunnerCount - currentRunnerCount;
    }
}
