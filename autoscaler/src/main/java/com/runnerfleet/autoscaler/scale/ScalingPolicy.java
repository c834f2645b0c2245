package com.runnerfleet.autoscaler.scale;

import com.runnerfleet.core.model.QueueMetrics;
import com.runnerfleet.core.model.ScalingAction;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides how many runners a fleet should have.
 * <p>
 * Formula:
 * <pre>
 *   target = clamp(ceil(pending / jobs_per_runner), min_runners, max_runners)
 *   scale up   if target &gt; current + scale_up_threshold
 *   scale down if target &lt; current - scale_down_threshold
 *   maintain   otherwise
 * </pre>
 * </p>
 * <p>
 * Comparisons are strict, so a target exactly on the dead-band boundary maintains.
 * Nothing changes while the fleet's cooldown is active. The only input besides the
 * arguments is the clock.
 * </p>
 */
public class ScalingPolicy {
    private final Clock clock;

    public ScalingPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param metrics        queue snapshot of this tick
     * @param currentCount   number of active workers
     * @param config         fleet scaling parameters
     * @param lastActionTime time of the last scale up or down, {@code null} if none yet
     */
    public ScalingDecision decide(QueueMetrics metrics, int currentCount, ScalingConfig config,
                                  Instant lastActionTime) {
        if (currentCount < 0) {
            throw new IllegalArgumentException("Current runner count cannot be negative: " + currentCount);
        }

        ScalingDecision cooldown = cooldownDecision(currentCount, config, lastActionTime);
        if (cooldown != null) {
            return cooldown;
        }

        int pending = metrics.getPendingJobs();
        int raw = (pending + config.getJobsPerRunner() - 1) / config.getJobsPerRunner();
        int target = config.clamp(raw);

        ScalingDecision.ScalingDecisionBuilder decision = ScalingDecision.builder()
            .targetRunnerCount(target)
            .currentRunnerCount(currentCount);

        if (target == currentCount) {
            return decision.action(ScalingAction.MAINTAIN)
                .reason(String.format("At target: %d runners for %d pending jobs", target, pending))
                .build();
        }
        if (target > currentCount + config.getScaleUpThreshold()) {
            return decision.action(ScalingAction.SCALE_UP)
                .reason(String.format("%d pending jobs need %d runners, have %d", pending, target, currentCount))
                .build();
        }
        if (target < currentCount - config.getScaleDownThreshold()) {
            return decision.action(ScalingAction.SCALE_DOWN)
                .reason(String.format("%d pending jobs need only %d runners, have %d", pending, target, currentCount))
                .build();
        }
        return decision.action(ScalingAction.MAINTAIN)
            .reason(String.format("Within dead-band: target %d, current %d", target, currentCount))
            .build();
    }

    /**
     * Operator-requested scale to a fixed count. Skips the queue-based target and the
     * dead-band but still clamps to the configured bounds and respects the cooldown.
     */
    public ScalingDecision decideManual(int requestedCount, int currentCount, ScalingConfig config,
                                        Instant lastActionTime) {
        if (requestedCount < 0) {
            throw new IllegalArgumentException("Requested runner count cannot be negative: " + requestedCount);
        }
        if (currentCount < 0) {
            throw new IllegalArgumentException("Current runner count cannot be negative: " + currentCount);
        }

        ScalingDecision cooldown = cooldownDecision(currentCount, config, lastActionTime);
        if (cooldown != null) {
            return cooldown;
        }

        int target = config.clamp(requestedCount);
        ScalingAction action = target > currentCount ? ScalingAction.SCALE_UP
            : target < currentCount ? ScalingAction.SCALE_DOWN
            : ScalingAction.MAINTAIN;

        String reason = target == requestedCount
            ? String.format("Manual scale to %d", target)
            : String.format("Manual scale to %d (clamped to %d)", requestedCount, target);

        return ScalingDecision.builder()
            .action(action)
            .targetRunnerCount(target)
            .currentRunnerCount(currentCount)
            .reason(reason)
            .build();
    }

    private ScalingDecision cooldownDecision(int currentCount, ScalingConfig config, Instant lastActionTime) {
        if (lastActionTime == null) {
            return null;
        }
        Duration elapsed = Duration.between(lastActionTime, clock.instant());
        if (elapsed.compareTo(config.getCooldown()) >= 0) {
            return null;
        }
        return ScalingDecision.builder()
            .action(ScalingAction.MAINTAIN)
            .targetRunnerCount(currentCount)
            .currentRunnerCount(currentCount)
            .reason(String.format("Cooldown active (%ds of %ds elapsed)",
                elapsed.toSeconds(), config.getCooldown().toSeconds()))
            .build();
    }
}
