package com.runnerfleet.autoscaler.github;

import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.QueueMetrics;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the CI job queue.
 */
public interface IQueueObserver {

    /**
     * Counts the jobs that require all of the fleet's labels.
     * Fails with {@link com.runnerfleet.core.error.QueueObservationException} on timeout or
     * transport error; callers must treat that as "no decision", never as zero jobs.
     */
    Mono<QueueMetrics> metrics(FleetConfig fleet);
}
