package com.runnerfleet.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time job counts for the jobs matching a fleet's labels.
 * <p>
 * {@code pendingJobs} counts every job still waiting for a runner and includes
 * {@code queuedJobs}. Created fresh on each tick and never mutated.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class QueueMetrics {
    int pendingJobs;
    int inProgressJobs;
    int queuedJobs;
    int totalJobs;
    Instant timestamp;

    @JsonIgnore
    public boolean needsScaling() {
        return pendingJobs > 0 || queuedJobs > 0;
    }
}
