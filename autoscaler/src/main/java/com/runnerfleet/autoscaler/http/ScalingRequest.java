package com.runnerfleet.autoscaler.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.runnerfleet.core.model.ScalingConfig;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Scaling parameters as sent by the operator. Absent fields keep their current
 * (or default) value.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScalingRequest {
    private Integer minRunners;
    private Integer maxRunners;
    private Integer jobsPerRunner;
    private Integer scaleUpThreshold;
    private Integer scaleDownThreshold;
    private Long cooldownSeconds;
    private Long maxWorkerAgeSeconds;

    /**
     * @throws IllegalArgumentException if the merged parameters are invalid
     */
    public ScalingConfig applyTo(ScalingConfig base) {
        ScalingConfig.ScalingConfigBuilder builder = base.toBuilder();
        if (minRunners != null) {
            builder.minRunners(minRunners);
        }
        if (maxRunners != null) {
            builder.maxRunners(maxRunners);
        }
        if (jobsPerRunner != null) {
            builder.jobsPerRunner(jobsPerRunner);
        }
        if (scaleUpThreshold != null) {
            builder.scaleUpThreshold(scaleUpThreshold);
        }
        if (scaleDownThreshold != null) {
            builder.scaleDownThreshold(scaleDownThreshold);
        }
        if (cooldownSeconds != null) {
            builder.cooldown(Duration.ofSeconds(cooldownSeconds));
        }
        if (maxWorkerAgeSeconds != null) {
            builder.maxWorkerAge(Duration.ofSeconds(maxWorkerAgeSeconds));
        }
        return builder.build();
    }
}
