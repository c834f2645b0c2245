package com.runnerfleet.autoscaler.kafka;

import com.runnerfleet.core.msg.ControlMessages;
import reactor.core.publisher.Mono;

/**
 * Used when no Kafka bootstrap servers are configured.
 */
public class NoopFleetEventPublisher implements IFleetEventPublisher {

    @Override
    public Mono<Void> publishScaleSignal(ControlMessages.ScaleSignal scaleSignal) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> publishWorkerEvent(ControlMessages.WorkerEvent workerEvent) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> publishFleetDegraded(ControlMessages.FleetDegraded fleetDegraded) {
        return Mono.empty();
    }

    @Override
    public void close() {
    }
}
