package com.runnerfleet.core.model;

/**
 * Outcome of one scaling policy evaluation.
 */
public enum ScalingAction {
    SCALE_UP,
    SCALE_DOWN,
    MAINTAIN;

    public String tagValue() {
        return name().toLowerCase();
    }
}
