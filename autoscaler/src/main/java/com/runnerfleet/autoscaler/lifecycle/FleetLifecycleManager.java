package com.runnerfleet.autoscaler.lifecycle;

import com.runnerfleet.autoscaler.compute.ComputeSpec;
import com.runnerfleet.autoscaler.compute.IComputeProvisioner;
import com.runnerfleet.autoscaler.github.IWorkerRegistry;
import com.runnerfleet.core.error.WorkerNotFoundException;
import com.runnerfleet.core.error.WorkerRegistrationException;
import com.runnerfleet.core.error.WorkerTeardownException;
import com.runnerfleet.core.metrics.MetricsNames;
import com.runnerfleet.core.metrics.MetricsTags;
import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.WorkerInfo;
import com.runnerfleet.core.model.WorkerStatus;
import com.runnerfleet.core.util.SecretRedactor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Drives ephemeral workers through their lifecycle.
 * <p>
 * {@link #provision} is a short saga: compute instance, registration token, registration,
 * then waiting for the worker to come online. Each step knows what the previous ones
 * created, so a failure undoes exactly that:
 * <ul>
 *   <li>compute failed: nothing to undo, the error propagates</li>
 *   <li>token or registration failed: the compute instance is destroyed first</li>
 *   <li>worker never came online: it is deregistered and its instance destroyed</li>
 * </ul>
 * </p>
 * <p>
 * Every new snapshot is reported to the caller's {@link WorkerTransitionListener}
 * before the next step starts, so the caller always knows which instances exist.
 * </p>
 */
public class FleetLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(FleetLifecycleManager.class);

    static final String OP_PROVISION = "provision";
    static final String OP_DESTROY = "destroy";
    static final String OP_ROTATE = "rotate";

    private final IWorkerRegistry registry;
    private final IComputeProvisioner compute;
    private final Clock clock;
    private final Duration onlineTimeout;
    private final Duration pollInterval;
    private final MeterRegistry meterRegistry;
    private final Timer provisionLatency;

    public FleetLifecycleManager(IWorkerRegistry registry, IComputeProvisioner compute, Clock clock,
                                 Duration onlineTimeout, Duration pollInterval, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.compute = compute;
        this.clock = clock;
        this.onlineTimeout = onlineTimeout;
        this.pollInterval = pollInterval;
        this.meterRegistry = meterRegistry;

        this.provisionLatency = Timer.builder(MetricsNames.WORKER_PROVISION_LATENCY)
            .description("Time from provision start until the worker is active")
            .register(meterRegistry);
    }

    /**
     * Creates a new worker and returns it once it is {@code ACTIVE}.
     */
    public Mono<EphemeralWorker> provision(FleetConfig fleet, WorkerTransitionListener listener) {
        return Mono.defer(() -> {
            EphemeralWorker worker = EphemeralWorker.builder()
                .name(newWorkerName(fleet))
                .fleetName(fleet.getName())
                .createdAt(clock.instant())
                .status(WorkerStatus.PROVISIONING)
                .build();
            report(listener, worker);
            Timer.Sample sample = Timer.start(meterRegistry);

            return compute.provision(ComputeSpec.builder().name(worker.getName()).fleetName(fleet.getName()).build())
                .onErrorResume(err -> {
                    // nothing was created
                    report(listener, worker.transitionTo(WorkerStatus.DESTROYED));
                    return Mono.error(err);
                })
                .map(worker::withCompute)
                .doOnNext(withCompute -> report(listener, withCompute))
                .flatMap(withCompute -> register(fleet, withCompute, listener))
                .flatMap(registered -> awaitOnline(fleet, registered, listener))
                .doOnNext(active -> {
                    sample.stop(provisionLatency);
                    log.info("Worker {} of fleet {} is active (id={})",
                        active.getName(), fleet.getName(), active.getWorkerId());
                });
        })
            .doOnSuccess(w -> recordOperation(OP_PROVISION, MetricsTags.SUCCESS))
            .doOnError(err -> {
                recordOperation(OP_PROVISION, MetricsTags.FAILURE);
                log.error("Provisioning for fleet {} failed: {}", fleet.getName(), SecretRedactor.describe(err));
            });
    }

    /**
     * Deregisters the worker and destroys its compute instance. Both steps are always
     * attempted and the worker always ends {@code DESTROYED}; failed steps are reported
     * through a {@link WorkerTeardownException}.
     */
    public Mono<Void> destroy(FleetConfig fleet, EphemeralWorker worker, WorkerTransitionListener listener) {
        return teardown(fleet, worker, listener)
            .doOnSuccess(v -> recordOperation(OP_DESTROY, MetricsTags.SUCCESS))
            .doOnError(err -> {
                recordOperation(OP_DESTROY, MetricsTags.FAILURE);
                log.error("Destroying worker {} finished with errors: {}", worker.getName(), SecretRedactor.describe(err));
            });
    }

    /**
     * Replaces a worker without a capacity gap: the replacement must be active before the
     * old worker is destroyed. If the replacement fails, the old worker is left untouched.
     *
     * @return the replacement worker
     */
    public Mono<EphemeralWorker> rotate(FleetConfig fleet, EphemeralWorker oldWorker, WorkerTransitionListener listener) {
        return provision(fleet, listener)
            .flatMap(replacement -> destroy(fleet, oldWorker, listener)
                // the old worker is gone from the tracked set even if teardown failed
                .onErrorResume(err -> Mono.empty())
                .thenReturn(replacement))
            .doOnSuccess(replacement -> {
                recordOperation(OP_ROTATE, MetricsTags.SUCCESS);
                log.info("Rotated worker {} -> {}", oldWorker.getName(), replacement.getName());
            })
            .doOnError(err -> {
                recordOperation(OP_ROTATE, MetricsTags.FAILURE);
                log.warn("Rotation of worker {} aborted, keeping it: {}", oldWorker.getName(), SecretRedactor.describe(err));
            });
    }

    /**
     * @return {@code true} only if the provider knows the worker and reports it online;
     * any lookup error counts as unhealthy
     */
    public Mono<Boolean> checkHealth(FleetConfig fleet, EphemeralWorker worker) {
        return health(fleet, worker)
            .doOnNext(health -> {
                if (health.isUnknown()) {
                    log.debug("Health check of {} failed: {}", worker.getName(), SecretRedactor.describe(health.getError()));
                }
            })
            .map(WorkerHealth::isHealthy);
    }

    /**
     * Classifies a worker from the provider's view of it. Never fails: a worker the provider
     * dropped is {@code GONE}, a lookup error leaves it {@code UNKNOWN}.
     */
    public Mono<WorkerHealth> health(FleetConfig fleet, EphemeralWorker worker) {
        if (!worker.isRegistered()) {
            return Mono.just(WorkerHealth.unknown(
                new IllegalStateException("Worker " + worker.getName() + " is not registered")));
        }
        return registry.status(fleet, worker.getWorkerId())
            .map(WorkerHealth::of)
            .onErrorResume(WorkerNotFoundException.class, err -> Mono.just(WorkerHealth.gone()))
            .onErrorResume(err -> Mono.just(WorkerHealth.unknown(err)));
    }

    private Mono<EphemeralWorker> register(FleetConfig fleet, EphemeralWorker worker, WorkerTransitionListener listener) {
        return registry.getRegistrationToken(fleet)
            .flatMap(token -> registry.register(worker.getCompute(), fleet, token, worker.getName()))
            .map(workerId -> worker.withWorkerId(workerId).transitionTo(WorkerStatus.REGISTERED))
            .doOnNext(registered -> report(listener, registered))
            .onErrorResume(err -> this.<EphemeralWorker>compensate(fleet, worker, err, listener));
    }

    private Mono<EphemeralWorker> awaitOnline(FleetConfig fleet, EphemeralWorker worker, WorkerTransitionListener listener) {
        return Mono.defer(() -> registry.status(fleet, worker.getWorkerId()))
            .filter(WorkerInfo::isOnline)
            // the provider may not list a just-configured runner yet
            .onErrorResume(WorkerNotFoundException.class, err -> Mono.empty())
            .repeatWhenEmpty(repeats -> repeats.delayElements(pollInterval))
            .timeout(onlineTimeout)
            .onErrorMap(TimeoutException.class, err -> new WorkerRegistrationException(
                "Worker " + worker.getName() + " did not come online within " + onlineTimeout.toSeconds() + "s", err))
            .map(info -> worker.transitionTo(WorkerStatus.ACTIVE))
            .doOnNext(active -> report(listener, active))
            .onErrorResume(err -> this.<EphemeralWorker>compensate(fleet, worker, err, listener));
    }

    /**
     * Undoes what the failed provisioning created, then re-emits the original failure with
     * any cleanup failures attached as suppressed.
     */
    private <T> Mono<T> compensate(FleetConfig fleet, EphemeralWorker worker, Throwable cause,
                                   WorkerTransitionListener listener) {
        log.warn("Provisioning of worker {} failed after its instance was created, cleaning up: {}",
            worker.getName(), SecretRedactor.describe(cause));
        return teardown(fleet, worker, listener)
            .onErrorResume(cleanupErr -> {
                cause.addSuppressed(cleanupErr);
                return Mono.empty();
            })
            .then(Mono.error(cause));
    }

    private Mono<Void> teardown(FleetConfig fleet, EphemeralWorker worker, WorkerTransitionListener listener) {
        return Mono.defer(() -> {
            if (worker.getStatus().isTerminal()) {
                return Mono.empty();
            }
            EphemeralWorker draining = worker.transitionTo(WorkerStatus.DRAINING);
            report(listener, draining);

            List<Throwable> failures = new ArrayList<>();

            Mono<Void> deregister = draining.isRegistered()
                ? registry.deregister(fleet, draining.getWorkerId())
                    .onErrorResume(err -> {
                        failures.add(err);
                        log.warn("Deregistering worker {} failed, destroying its instance anyway: {}",
                            draining.getName(), SecretRedactor.describe(err));
                        return Mono.empty();
                    })
                : Mono.empty();

            Mono<Void> destroyCompute = draining.getCompute() != null
                ? compute.destroy(draining.getCompute())
                    .onErrorResume(err -> {
                        failures.add(err);
                        log.error("Destroying instance of worker {} failed: {}",
                            draining.getName(), SecretRedactor.describe(err));
                        return Mono.empty();
                    })
                : Mono.empty();

            return deregister
                .then(destroyCompute)
                .then(Mono.defer(() -> {
                    report(listener, draining.transitionTo(WorkerStatus.DESTROYED));
                    if (failures.isEmpty()) {
                        return Mono.<Void>empty();
                    }
                    WorkerTeardownException error = new WorkerTeardownException(draining.getName(), failures.get(0));
                    failures.stream().skip(1).forEach(error::addSuppressed);
                    return Mono.<Void>error(error);
                }));
        });
    }

    private void report(WorkerTransitionListener listener, EphemeralWorker worker) {
        Counter.builder(MetricsNames.WORKER_TRANSITIONS_TOTAL)
            .tag(MetricsTags.STATE, worker.getStatus().name().toLowerCase())
            .register(meterRegistry)
            .increment();
        log.debug("Worker {} -> {}", worker.getName(), worker.getStatus());
        listener.onTransition(worker);
    }

    private void recordOperation(String operation, String outcome) {
        Counter.builder(MetricsNames.WORKER_OPERATIONS_TOTAL)
            .tag(MetricsTags.OPERATION, operation)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry)
            .increment();
    }

    static String newWorkerName(FleetConfig fleet) {
        return fleet.getName() + "-runner-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
