package com.runnerfleet.autoscaler.support;

import com.runnerfleet.autoscaler.github.IQueueObserver;
import com.runnerfleet.core.error.QueueObservationException;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.QueueMetrics;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Queue observer reporting a settable number of pending jobs.
 */
public class FakeQueueObserver implements IQueueObserver {
    public volatile int pendingJobs;
    public volatile boolean fail;

    @Override
    public Mono<QueueMetrics> metrics(FleetConfig fleet) {
        return Mono.defer(() -> {
            if (fail) {
                return Mono.error(new QueueObservationException("timed out after 30s"));
            }
            return Mono.just(QueueMetrics.builder()
                .pendingJobs(pendingJobs)
                .queuedJobs(pendingJobs)
                .totalJobs(pendingJobs)
                .timestamp(Instant.now())
                .build());
        });
    }
}
