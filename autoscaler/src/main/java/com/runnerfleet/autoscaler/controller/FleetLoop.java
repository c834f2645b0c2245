package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.autoscaler.github.IQueueObserver;
import com.runnerfleet.autoscaler.kafka.IFleetEventPublisher;
import com.runnerfleet.autoscaler.lifecycle.FleetLifecycleManager;
import com.runnerfleet.autoscaler.lifecycle.WorkerHealth;
import com.runnerfleet.autoscaler.lifecycle.WorkerTransitionListener;
import com.runnerfleet.autoscaler.scale.ScaleDownSelector;
import com.runnerfleet.autoscaler.scale.ScalingPolicy;
import com.runnerfleet.core.error.QueueObservationException;
import com.runnerfleet.core.metrics.MetricsNames;
import com.runnerfleet.core.metrics.MetricsTags;
import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.ScalingAction;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;
import com.runnerfleet.core.model.WorkerStatus;
import com.runnerfleet.core.msg.ControlMessages;
import com.runnerfleet.core.util.SecretRedactor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Control loop of one fleet.
 * <p>
 * Ticks, operator requests and results of finished worker operations are all turned into
 * commands and processed one at a time from a single queue, so {@link FleetState} has
 * exactly one writer. A tick observes the queue, decides and dispatches worker operations
 * without waiting for them; their outcomes come back as later commands.
 * </p>
 * <p>
 * Readers get the {@link FleetStatus} snapshot published after each command.
 * </p>
 */
class FleetLoop {
    private static final Logger log = LoggerFactory.getLogger(FleetLoop.class);

    private static final int STATUS_CONCURRENCY = 4;
    private static final Duration EMIT_RETRY = Duration.ofSeconds(1);

    @FunctionalInterface
    interface Command {
        Mono<Void> execute();
    }

    private final FleetState state;
    private final String name;
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

    private final Sinks.Many<Command> commands = Sinks.many().unicast().onBackpressureBuffer();
    private final Set<Sinks.Empty<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final WorkerTransitionListener transitions = worker -> post(() -> onTransition(worker));
    private final List<Gauge> gauges = new ArrayList<>();

    // loop-confined
    private final Set<String> rotating = new HashSet<>();
    private Set<String> statusUnknown = Set.of();

    private volatile boolean stopping;
    private volatile boolean terminated;
    private volatile FleetStatus status;
    private Disposable subscription;

    FleetLoop(FleetConfig fleet, ScalingConfig scaling, IQueueObserver queueObserver, ScalingPolicy policy,
              ScaleDownSelector selector, FleetLifecycleManager lifecycle, OperationLimiter limiter,
              IFleetEventPublisher publisher, MeterRegistry meterRegistry, Clock clock,
              Duration tickInterval, int degradedAfterRounds) {
        this.state = new FleetState(fleet, scaling);
        this.name = fleet.getName();
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
        this.status = state.snapshot(false);
    }

    void start() {
        gauges.add(Gauge.builder(MetricsNames.WORKERS, this, loop -> loop.status().getTrackedWorkers())
            .tag(MetricsTags.FLEET, name)
            .register(meterRegistry));
        gauges.add(Gauge.builder(MetricsNames.WORKERS_ACTIVE, this, loop -> loop.status().getActiveWorkers())
            .tag(MetricsTags.FLEET, name)
            .register(meterRegistry));
        gauges.add(Gauge.builder(MetricsNames.DEGRADED, this, loop -> loop.status().isDegraded() ? 1 : 0)
            .tag(MetricsTags.FLEET, name)
            .register(meterRegistry));

        Command scheduledTick = () -> tick()
            .onErrorResume(err -> Mono.empty())
            .doFinally(signal -> refreshStatus())
            .then();

        Flux<Command> ticks = Flux.interval(tickInterval)
            .onBackpressureDrop(n -> log.debug("Fleet {} is still busy, dropping tick {}", name, n))
            .map(n -> scheduledTick);

        subscription = Flux.merge(1, commands.asFlux(), ticks)
            .concatMap(command -> command.execute()
                .onErrorResume(err -> {
                    log.error("Fleet {} command failed: {}", name, SecretRedactor.describe(err), err);
                    return Mono.empty();
                }), 1)
            .subscribe();

        log.info("Fleet {} started: repository={}, labels={}, tick every {}s",
            name, state.fleet.getRepository(), state.fleet.getLabels(), tickInterval.toSeconds());
    }

    FleetStatus status() {
        return status;
    }

    /**
     * Runs one tick right away, queued behind any command already waiting.
     */
    Mono<ScalingDecision> evaluateNow() {
        return submit(this::tick);
    }

    Mono<ScalingDecision> scaleTo(int count) {
        return submit(() -> Mono.fromCallable(() -> {
            ensureRunning();
            ScalingDecision decision = policy.decideManual(count, state.activeCount(), state.scaling, state.lastActionTime);
            execute(decision, true);
            return decision;
        }));
    }

    Mono<FleetStatus> updateScaling(ScalingConfig scaling) {
        return submit(() -> Mono.fromCallable(() -> {
            state.scaling = scaling;
            log.info("Fleet {} scaling updated: {}", name, scaling);
            return state.snapshot(stopping);
        }));
    }

    /**
     * Replaces one active worker. Completes with the replacement once it is active.
     */
    Mono<EphemeralWorker> rotate(String workerName) {
        return submit(() -> Mono.fromCallable(() -> {
            ensureRunning();
            EphemeralWorker worker = state.worker(workerName)
                .filter(w -> w.getStatus() == WorkerStatus.ACTIVE)
                .orElseThrow(() -> new NoSuchElementException(
                    "No active worker " + workerName + " in fleet " + name));
            if (rotating.contains(workerName)) {
                throw new IllegalStateException("Worker " + workerName + " is already being rotated");
            }
            return dispatchRotate(worker);
        })).flatMap(Function.identity());
    }

    /**
     * Stops ticking, lets in-flight operations finish and applies their results, optionally
     * destroys every remaining worker, then tears the loop down.
     */
    Mono<Void> disable(boolean drain) {
        return Mono.defer(() -> {
            stopping = true;
            log.info("Disabling fleet {} (drain={}), waiting for {} in-flight operations", name, drain, inFlight.size());
            return awaitInFlight()
                .then(submit(() -> Mono.fromRunnable(() -> {
                    if (drain) {
                        drainAll();
                    }
                })))
                .then(awaitInFlight())
                .then(submit(() -> Mono.<Void>empty()))
                .then(Mono.fromRunnable(this::stop).subscribeOn(Schedulers.boundedElastic()))
                .then();
        });
    }

    private Mono<ScalingDecision> tick() {
        if (stopping) {
            return Mono.empty();
        }
        // nothing is reconciled or decided unless the queue could be read
        return Mono.defer(() -> queueObserver.metrics(state.fleet))
            .flatMap(metrics -> reconcile().thenReturn(metrics))
            .map(metrics -> {
                state.previousMetrics = metrics;
                ScalingDecision decision = policy.decide(metrics, state.activeCount(), state.scaling, state.lastActionTime);
                execute(decision, false);
                return decision;
            })
            .doOnError(err -> {
                String reason = err instanceof QueueObservationException ? "queue_unavailable" : "error";
                Counter.builder(MetricsNames.TICKS_SKIPPED_TOTAL)
                    .tag(MetricsTags.FLEET, name)
                    .tag(MetricsTags.REASON, reason)
                    .register(meterRegistry)
                    .increment();
                log.warn("Fleet {} made no decision this tick: {}", name, SecretRedactor.describe(err));
            });
    }

    private void execute(ScalingDecision decision, boolean manual) {
        state.lastDecision = decision;
        Counter.builder(MetricsNames.SCALING_DECISIONS_TOTAL)
            .tag(MetricsTags.FLEET, name)
            .tag(MetricsTags.ACTION, decision.getAction().tagValue())
            .register(meterRegistry)
            .increment();

        if (decision.getAction() == ScalingAction.MAINTAIN) {
            log.debug("Fleet {}: maintain {} runners ({})", name, decision.getCurrentRunnerCount(), decision.getReason());
            return;
        }

        state.lastActionTime = clock.instant();
        log.info("Fleet {}: {} {} -> {} runners ({}{})", name, decision.getAction().tagValue(),
            decision.getCurrentRunnerCount(), decision.getTargetRunnerCount(), decision.getReason(),
            manual ? ", manual" : "");
        fire(publisher.publishScaleSignal(ControlMessages.ScaleSignal.builder()
            .fleet(name)
            .decision(decision)
            .manual(manual)
            .ts(clock.millis())
            .build()));

        if (decision.getAction() == ScalingAction.SCALE_UP) {
            ProvisionRound round = new ProvisionRound(decision.delta());
            for (int i = 0; i < decision.delta(); i++) {
                dispatch(lifecycle.provision(state.fleet, transitions), true,
                    (worker, err) -> post(() -> onProvisionResult(round, err)));
            }
            return;
        }

        // idle before busy; a worker whose status could not be read counts as busy
        List<EphemeralWorker> candidates = state.active().stream()
            .filter(w -> !rotating.contains(w.getName()))
            .map(w -> statusUnknown.contains(w.getName()) ? w.withBusy(true) : w)
            .collect(Collectors.toList());
        for (EphemeralWorker selected : selector.select(candidates, -decision.delta())) {
            state.worker(selected.getName()).ifPresent(this::dispatchDestroy);
        }
    }

    /**
     * Refreshes active workers from the provider. An ephemeral worker that was busy and is now
     * gone or offline finished its job; one that is gone without ever having been busy is
     * unhealthy. Both are destroyed so later ticks can replace them.
     */
    private Mono<Void> reconcile() {
        List<EphemeralWorker> active = state.active().stream()
            .filter(w -> !rotating.contains(w.getName()))
            .collect(Collectors.toList());

        return Flux.fromIterable(active)
            .flatMap(worker -> lifecycle.health(state.fleet, worker)
                .map(health -> new Observation(worker, health)), STATUS_CONCURRENCY)
            .collectList()
            .doOnNext(observations -> {
                Set<String> unknown = new HashSet<>();
                for (Observation observation : observations) {
                    apply(observation, unknown);
                }
                statusUnknown = unknown;
                rotateAged();
            })
            .then();
    }

    private void apply(Observation observation, Set<String> unknown) {
        EphemeralWorker worker = observation.worker;
        WorkerHealth health = observation.health;
        if (health.isGone()) {
            if (worker.isBusy()) {
                worker = worker.recordJobCompleted();
                log.info("Worker {} finished its job, destroying it", worker.getName());
            } else {
                log.warn("Worker {} is offline or unknown to the provider, destroying it", worker.getName());
            }
            dispatchDestroy(worker);
        } else if (health.isUnknown()) {
            unknown.add(worker.getName());
            log.debug("Status of worker {} unavailable: {}", worker.getName(), SecretRedactor.describe(health.getError()));
        } else if (health.isBusy() != worker.isBusy()) {
            state.apply(worker.withBusy(health.isBusy()));
        }
    }

    private void rotateAged() {
        ScalingConfig scaling = state.scaling;
        if (!scaling.isRotationEnabled() || !rotating.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        state.active().stream()
            .filter(w -> !w.isBusy() && !statusUnknown.contains(w.getName()))
            .filter(w -> w.age(now).compareTo(scaling.getMaxWorkerAge()) > 0)
            .min(Comparator.comparing(EphemeralWorker::getCreatedAt))
            .ifPresent(worker -> {
                log.info("Worker {} is older than {}s, rotating it", worker.getName(), scaling.getMaxWorkerAge().toSeconds());
                dispatchRotate(worker);
            });
    }

    private void drainAll() {
        List<EphemeralWorker> remaining = state.tracked().stream()
            .filter(w -> w.getStatus() != WorkerStatus.DRAINING)
            .collect(Collectors.toList());
        log.info("Draining fleet {}: destroying {} workers", name, remaining.size());
        remaining.forEach(this::dispatchDestroy);
    }

    private void dispatchDestroy(EphemeralWorker worker) {
        EphemeralWorker draining = worker.transitionTo(WorkerStatus.DRAINING);
        state.apply(draining);
        // issued destroys always run, even while the fleet is stopping
        dispatch(lifecycle.destroy(state.fleet, draining, transitions), false, (v, err) -> { });
    }

    private Mono<EphemeralWorker> dispatchRotate(EphemeralWorker worker) {
        rotating.add(worker.getName());
        return dispatch(lifecycle.rotate(state.fleet, worker, transitions), true,
            (replacement, err) -> post(() -> rotating.remove(worker.getName())));
    }

    /**
     * Subscribes to a worker operation under the global concurrency limit and tracks it until
     * it terminates. {@code onResult} runs before the operation stops counting as in flight.
     */
    private <T> Mono<T> dispatch(Mono<T> operation, boolean abortWhenStopping, BiConsumer<T, Throwable> onResult) {
        Sinks.Empty<Void> done = Sinks.empty();
        inFlight.add(done);

        Mono<T> result = limiter.run(operation, () -> !(abortWhenStopping && stopping))
            .doOnSuccess(value -> onResult.accept(value, null))
            .doOnError(err -> onResult.accept(null, err))
            .doFinally(signal -> {
                inFlight.remove(done);
                done.tryEmitEmpty();
            })
            .cache();

        // failures are logged by the lifecycle manager
        result.subscribe(value -> { }, err -> log.debug("Fleet {} operation ended with error: {}",
            name, SecretRedactor.describe(err)));
        return result;
    }

    private void onTransition(EphemeralWorker worker) {
        state.apply(worker);
        fire(publisher.publishWorkerEvent(ControlMessages.WorkerEvent.builder()
            .fleet(name)
            .workerName(worker.getName())
            .workerId(worker.getWorkerId())
            .status(worker.getStatus())
            .ts(clock.millis())
            .build()));
    }

    private void onProvisionResult(ProvisionRound round, Throwable err) {
        round.remaining--;
        if (err == null) {
            round.succeeded++;
            if (state.degraded) {
                log.info("Fleet {} recovered: provisioning succeeded again", name);
            }
            state.consecutiveFailedRounds = 0;
            state.degraded = false;
        } else if (!(err instanceof CancellationException)) {
            round.failed++;
            state.lastError = SecretRedactor.describe(err);
        }

        if (round.remaining > 0 || round.succeeded > 0 || round.failed == 0) {
            return;
        }
        state.consecutiveFailedRounds++;
        if (!state.degraded && state.consecutiveFailedRounds >= degradedAfterRounds) {
            state.degraded = true;
            log.warn("Fleet {} is degraded: the last {} provisioning rounds all failed (last error: {})",
                name, state.consecutiveFailedRounds, state.lastError);
            fire(publisher.publishFleetDegraded(ControlMessages.FleetDegraded.builder()
                .fleet(name)
                .consecutiveFailedRounds(state.consecutiveFailedRounds)
                .lastError(state.lastError)
                .ts(clock.millis())
                .build()));
        }
    }

    private <T> Mono<T> submit(Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.One<T> reply = Sinks.one();
            Command command = () -> Mono.defer(work)
                .doOnSuccess(value -> {
                    refreshStatus();
                    if (value == null) {
                        reply.tryEmitEmpty();
                    } else {
                        reply.tryEmitValue(value);
                    }
                })
                .doOnError(err -> {
                    refreshStatus();
                    reply.tryEmitError(err);
                })
                // delivered through the reply
                .onErrorResume(err -> Mono.empty())
                .then();

            if (!enqueue(command)) {
                return Mono.error(new IllegalStateException("Fleet " + name + " is disabled"));
            }
            return reply.asMono();
        });
    }

    private void post(Runnable update) {
        submit(() -> Mono.fromRunnable(update))
            .subscribe(value -> { }, err -> log.debug("Fleet {} stopped, dropping update", name));
    }

    private boolean enqueue(Command command) {
        if (terminated) {
            return false;
        }
        try {
            commands.emitNext(command, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
            return true;
        } catch (Sinks.EmissionException e) {
            return false;
        }
    }

    private Mono<Void> awaitInFlight() {
        return Mono.defer(() -> Mono.when(inFlight.stream()
            .map(Sinks.Empty::asMono)
            .collect(Collectors.toList())));
    }

    private void ensureRunning() {
        if (stopping) {
            throw new IllegalStateException("Fleet " + name + " is being disabled");
        }
    }

    private void refreshStatus() {
        status = state.snapshot(stopping);
    }

    private void stop() {
        terminated = true;
        if (subscription != null) {
            subscription.dispose();
        }
        commands.tryEmitComplete();
        gauges.forEach(meterRegistry::remove);
        refreshStatus();
        log.info("Fleet {} stopped with {} tracked workers", name, status.getTrackedWorkers());
    }

    private void fire(Mono<Void> event) {
        event.subscribe(v -> { }, err -> log.debug("Event for fleet {} not published: {}", name, err.getMessage()));
    }

    private static final class Observation {
        final EphemeralWorker worker;
        final WorkerHealth health;

        Observation(EphemeralWorker worker, WorkerHealth health) {
            this.worker = worker;
            this.health = health;
        }
    }

    private static final class ProvisionRound {
        int remaining;
        int succeeded;
        int failed;

        ProvisionRound(int size) {
            this.remaining = size;
        }
    }
}
