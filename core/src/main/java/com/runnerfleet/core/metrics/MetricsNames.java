package com.runnerfleet.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code fleet.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Scaling decisions made.
     * <p>
     * Tags: fleet, action (scale_up/scale_down/maintain)
     * </p>
     */
    public static final String SCALING_DECISIONS_TOTAL = "fleet.scaling.decisions.total";

    /**
     * Counter: Ticks that made no decision.
     * <p>
     * Tags: fleet, reason
     * </p>
     */
    public static final String TICKS_SKIPPED_TOTAL = "fleet.ticks.skipped.total";

    /**
     * Gauge: Workers in the tracked set (provisioning, registered, active, draining).
     * <p>
     * Tags: fleet
     * </p>
     */
    public static final String WORKERS = "fleet.workers";

    /**
     * Gauge: Workers in the active state.
     * <p>
     * Tags: fleet
     * </p>
     */
    public static final String WORKERS_ACTIVE = "fleet.workers.active";

    /**
     * Gauge: 1 while every recent provisioning round of the fleet failed.
     * <p>
     * Tags: fleet
     * </p>
     */
    public static final String DEGRADED = "fleet.degraded";

    /**
     * Counter: Worker lifecycle operations.
     * <p>
     * Tags: operation (provision/destroy/rotate), outcome (success/failure)
     * </p>
     */
    public static final String WORKER_OPERATIONS_TOTAL = "fleet.worker.operations.total";

    /**
     * Counter: Worker state transitions.
     * <p>
     * Tags: state
     * </p>
     */
    public static final String WORKER_TRANSITIONS_TOTAL = "fleet.worker.transitions.total";

    /**
     * Timer: Time from provision start until the worker is active.
     */
    public static final String WORKER_PROVISION_LATENCY = "fleet.worker.provision.latency";

    /**
     * Gauge: Lifecycle operations currently holding a concurrency permit (all fleets).
     */
    public static final String OPERATIONS_INFLIGHT = "fleet.operations.inflight";

    /**
     * Counter: Provider responses that signalled rate limiting.
     * <p>
     * Tags: operation
     * </p>
     */
    public static final String GITHUB_RATE_LIMITED_TOTAL = "github.api.rate.limited.total";
}
