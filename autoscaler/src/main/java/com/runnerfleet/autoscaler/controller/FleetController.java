package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.autoscaler.github.IQueueObserver;
import com.runnerfleet.autoscaler.kafka.IFleetEventPublisher;
import com.runnerfleet.autoscaler.lifecycle.FleetLifecycleManager;
import com.runnerfleet.autoscaler.scale.ScaleDownSelector;
import com.runnerfleet.autoscaler.scale.ScalingPolicy;
import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Entry point for everything an operator can do with fleets.
 * <p>
 * Each enabled fleet gets its own {@link FleetLoop}. Loops share nothing except the
 * {@link OperationLimiter} that bounds provisioning and destruction across all fleets.
 * </p>
 */
public class FleetController {
    private static final Logger log = LoggerFactory.getLogger(FleetController.class);

    private final IQueueObserver queueObserver;
    private final ScalingPolicy policy;
    private final ScaleDownSelector selector;
    private final FleetLifecycleManager lifecycle;
    private final OperationLimiter limiter;
    private final IFleetEventPublisher publisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration tickInterval;
    private final int degradedAfterRounds;

    private final Map<String, FleetLoop> fleets = new ConcurrentHashMap<>();

    public FleetController(IQueueObserver queueObserver, ScalingPolicy policy, ScaleDownSelector selector,
                           FleetLifecycleManager lifecycle, OperationLimiter limiter,
                           IFleetEventPublisher publisher, MeterRegistry meterRegistry, Clock clock,
                           Duration tickInterval, int degradedAfterRounds) {
        this.queueObserver = queueObserver;
        this.policy = policy;
        this.selector = selector;
        this.lifecycle = lifecycle;
        this.limiter = limiter;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.degradedAfterRounds = degradedAfterRounds;
    }

    /**
     * Starts the tick loop of a new fleet. The first tick runs one interval after enabling;
     * use {@link #evaluateNow} to decide earlier.
     *
     * @throws IllegalStateException if a fleet with this name is already enabled
     */
    public FleetStatus enable(FleetConfig fleet, ScalingConfig scaling) {
        FleetLoop loop = new FleetLoop(fleet, scaling, queueObserver, policy, selector, lifecycle, limiter,
            publisher, meterRegistry, clock, tickInterval, degradedAfterRounds);

        if (fleets.putIfAbsent(fleet.getName(), loop) != null) {
            throw new IllegalStateException("Fleet " + fleet.getName() + " is already enabled");
        }
        loop.start();
        return loop.status();
    }

    /**
     * Stops a fleet. In-flight operations finish and are applied first; with {@code drain}
     * every remaining worker is destroyed before the fleet is removed.
     */
    public Mono<FleetStatus> disable(String name, boolean drain) {
        return Mono.defer(() -> {
            FleetLoop loop = loop(name);
            return loop.disable(drain)
                .then(Mono.fromCallable(() -> {
                    fleets.remove(name, loop);
                    log.info("Fleet {} disabled", name);
                    return loop.status();
                }));
        });
    }

    public Optional<FleetStatus> status(String name) {
        return Optional.ofNullable(fleets.get(name)).map(FleetLoop::status);
    }

    public List<FleetStatus> statuses() {
        return fleets.values().stream()
            .map(FleetLoop::status)
            .sorted(Comparator.comparing(FleetStatus::getFleet))
            .collect(Collectors.toList());
    }

    public Mono<ScalingDecision> evaluateNow(String name) {
        return Mono.defer(() -> loop(name).evaluateNow());
    }

    /**
     * Scales to {@code count} runners, clamped to the fleet's bounds and subject to its cooldown.
     */
    public Mono<ScalingDecision> scaleTo(String name, int count) {
        return Mono.defer(() -> loop(name).scaleTo(count));
    }

    /**
     * Replaces the fleet's scaling parameters. Takes effect from the next tick.
     */
    public Mono<FleetStatus> updateScaling(String name, ScalingConfig scaling) {
        return Mono.defer(() -> loop(name).updateScaling(scaling));
    }

    public Mono<EphemeralWorker> rotateWorker(String name, String workerName) {
        return Mono.defer(() -> loop(name).rotate(workerName));
    }

    /**
     * Disables every fleet without draining. Workers keep running and can be adopted or
     * cleaned up by the operator.
     */
    public Mono<Void> shutdown() {
        return Flux.fromIterable(List.copyOf(fleets.keySet()))
            .flatMap(name -> disable(name, false)
                .onErrorResume(err -> {
                    log.error("Failed to stop fleet {}: {}", name, err.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    private FleetLoop loop(String name) {
        FleetLoop loop = fleets.get(name);
        if (loop == null) {
            throw new NoSuchElementException("Fleet " + name + " is not enabled");
        }
        return loop;
    }
}
