package com.runnerfleet.autoscaler.kafka;

import com.runnerfleet.core.msg.ControlMessages;
import reactor.core.publisher.Mono;

/**
 * Publishes fleet control events. Callers subscribe and move on; a failed publish never
 * affects the control loop.
 */
public interface IFleetEventPublisher {
    Mono<Void> publishScaleSignal(ControlMessages.ScaleSignal scaleSignal);
    Mono<Void> publishWorkerEvent(ControlMessages.WorkerEvent workerEvent);
    Mono<Void> publishFleetDegraded(ControlMessages.FleetDegraded fleetDegraded);
    void close();
}
