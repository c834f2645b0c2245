package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.core.metrics.MetricsNames;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Bounds the number of provision, destroy and rotate operations in flight across all fleets.
 * <p>
 * Every operation goes through one shared queue drained with a bounded {@code flatMap}.
 * A waiting operation holds no thread; the next one starts when a running one terminates.
 * </p>
 */
public class OperationLimiter {
    private static final Logger log = LoggerFactory.getLogger(OperationLimiter.class);

    private final Sinks.Many<Mono<Void>> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Disposable drain;

    public OperationLimiter(int maxConcurrent, MeterRegistry meterRegistry) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("Concurrency limit must be positive: " + maxConcurrent);
        }

        Gauge.builder(MetricsNames.OPERATIONS_INFLIGHT, inFlight, AtomicInteger::get)
            .description("Lifecycle operations holding a concurrency permit")
            .register(meterRegistry);

        this.drain = queue.asFlux()
            .flatMap(task -> task, maxConcurrent)
            .subscribe(
                ignored -> { },
                err -> log.error("Operation queue terminated unexpectedly", err));
    }

    /**
     * Runs {@code operation} once fewer than the configured number of operations are running.
     * The operation is queued on subscription; cancelling the returned Mono before it starts
     * drops it from the queue.
     *
     * @param stillWanted checked when the operation's turn comes; if it returns {@code false}
     *                    the operation is not started and the Mono fails with
     *                    {@link CancellationException}
     */
    public <T> Mono<T> run(Mono<T> operation, BooleanSupplier stillWanted) {
        return Mono.defer(() -> {
            Sinks.One<T> result = Sinks.one();
            AtomicBoolean abandoned = new AtomicBoolean();

            Mono<Void> task = Mono.defer(() -> {
                if (abandoned.get()) {
                    return Mono.<Void>empty();
                }
                inFlight.incrementAndGet();
                Mono<T> started = stillWanted.getAsBoolean()
                    ? operation
                    : Mono.error(new CancellationException("Operation cancelled before it started"));
                return started
                    .doOnTerminate(inFlight::decrementAndGet)
                    .doOnCancel(inFlight::decrementAndGet)
                    .doOnSuccess(value -> {
                        if (value == null) {
                            result.tryEmitEmpty();
                        } else {
                            result.tryEmitValue(value);
                        }
                    })
                    .doOnError(result::tryEmitError)
                    .onErrorResume(err -> Mono.empty())
                    .then();
            });

            queue.emitNext(task, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
            return result.asMono().doOnCancel(() -> abandoned.set(true));
        });
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Stops accepting operations. Operations already running are not interrupted.
     */
    public void close() {
        queue.tryEmitComplete();
        drain.dispose();
    }
}
