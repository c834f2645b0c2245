package com.runnerfleet.core.msg;

/**
 * Kafka topics for fleet control events.
 */
public final class Topics {
    private Topics() {
    }

    /**
     * Scaling actions dispatched by a fleet's control loop. Keyed by fleet name.
     */
    public static final String FLEET_SCALE = "runner-fleet.scale";

    /**
     * Worker lifecycle transitions. Keyed by fleet name.
     */
    public static final String FLEET_WORKERS = "runner-fleet.workers";

    /**
     * Operator-visible alerts such as a degraded fleet. Keyed by fleet name.
     */
    public static final String FLEET_ALERTS = "runner-fleet.alerts";
}
