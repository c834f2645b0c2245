package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Scaling policy parameters for one fleet.
 * <p>
 * Bounds are inclusive. The thresholds form a dead-band around the current runner
 * count inside which no action is taken, and the cooldown is the minimum time between
 * two scaling actions of the same fleet.
 * </p>
 */
@Value
public class ScalingConfig {
    public static final int DEFAULT_MIN_RUNNERS = 0;
    public static final int DEFAULT_MAX_RUNNERS = 10;
    public static final int DEFAULT_JOBS_PER_RUNNER = 2;
    public static final int DEFAULT_SCALE_UP_THRESHOLD = 2;
    public static final int DEFAULT_SCALE_DOWN_THRESHOLD = 0;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);

    int minRunners;
    int maxRunners;

    /**
     * Target number of pending jobs per runner.
     */
    int jobsPerRunner;

    int scaleUpThreshold;
    int scaleDownThreshold;
    Duration cooldown;

    /**
     * Idle workers older than this are rotated. {@code null} or zero disables rotation.
     */
    Duration maxWorkerAge;

    @Builder(toBuilder = true)
    private ScalingConfig(int minRunners, int maxRunners, int jobsPerRunner,
                          int scaleUpThreshold, int scaleDownThreshold,
                          Duration cooldown, Duration maxWorkerAge) {
        if (minRunners < 0) {
            throw new IllegalArgumentException("min_runners cannot be negative: " + minRunners);
        }
        if (maxRunners < minRunners) {
            throw new IllegalArgumentException(
                "max_runners (" + maxRunners + ") must be >= min_runners (" + minRunners + ")");
        }
        if (jobsPerRunner <= 0) {
            throw new IllegalArgumentException("jobs_per_runner must be positive: " + jobsPerRunner);
        }
        if (scaleUpThreshold < 0 || scaleDownThreshold < 0) {
            throw new IllegalArgumentException("Scaling thresholds cannot be negative");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown cannot be negative: " + cooldown);
        }
        if (maxWorkerAge != null && maxWorkerAge.isNegative()) {
            throw new IllegalArgumentException("max worker age cannot be negative: " + maxWorkerAge);
        }

        this.minRunners = minRunners;
        this.maxRunners = maxRunners;
        this.jobsPerRunner = jobsPerRunner;
        this.scaleUpThreshold = scaleUpThreshold;
        this.scaleDownThreshold = scaleDownThreshold;
        this.cooldown = cooldown;
        this.maxWorkerAge = maxWorkerAge;
    }

    public static ScalingConfig defaults() {
        return builder().build();
    }

    public boolean isRotationEnabled() {
        return maxWorkerAge != null && !maxWorkerAge.isZero();
    }

    public int clamp(int runners) {
        return Math.max(minRunners, Math.min(maxRunners, runners));
    }

    public static class ScalingConfigBuilder {
        private int minRunners = DEFAULT_MIN_RUNNERS;
        private int maxRunners = DEFAULT_MAX_RUNNERS;
        private int jobsPerRunner = DEFAULT_JOBS_PER_RUNNER;
        private int scaleUpThreshold = DEFAULT_SCALE_UP_THRESHOLD;
        private int scaleDownThreshold = DEFAULT_SCALE_DOWN_THRESHOLD;
        private Duration cooldown = DEFAULT_COOLDOWN;
    }
}
