package com.runnerfleet.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 * <p>
 * Consistent tagging enables aggregation and filtering in Prometheus/Grafana.
 * </p>
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the fleet name.
     */
    public static final String FLEET = "fleet";

    /**
     * Tag key for scaling action (scale_up/scale_down/maintain).
     */
    public static final String ACTION = "action";

    /**
     * Tag key for a lifecycle operation or API call.
     */
    public static final String OPERATION = "operation";

    /**
     * Tag key for operation outcome (success/failure).
     */
    public static final String OUTCOME = "outcome";

    /**
     * Tag key for worker lifecycle state.
     */
    public static final String STATE = "state";

    /**
     * Tag key for skip/failure reason.
     */
    public static final String REASON = "reason";

    public static final String SUCCESS = "success";
    public static final String FAILURE = "failure";
}
