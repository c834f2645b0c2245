package com.runnerfleet.autoscaler.github;

import com.runnerfleet.core.model.ComputeHandle;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.RegistrationToken;
import com.runnerfleet.core.model.WorkerInfo;
import reactor.core.publisher.Mono;

/**
 * Worker registration against the CI provider.
 */
public interface IWorkerRegistry {

    /**
     * Fetches a single-use registration token. Fails with
     * {@link com.runnerfleet.core.error.RegistrationTokenException}.
     */
    Mono<RegistrationToken> getRegistrationToken(FleetConfig fleet);

    /**
     * Installs and starts an ephemeral worker process on the compute target, bound to the
     * provider with the given token. Emits the provider-assigned worker id, or fails with
     * {@link com.runnerfleet.core.error.WorkerRegistrationException}.
     */
    Mono<Long> register(ComputeHandle target, FleetConfig fleet, RegistrationToken token, String workerName);

    /**
     * Removes a worker registration. Idempotent: an already removed worker completes normally.
     * Other failures raise {@link com.runnerfleet.core.error.WorkerDeregistrationException}.
     */
    Mono<Void> deregister(FleetConfig fleet, long workerId);

    /**
     * Fetches the provider view of a worker, or fails with
     * {@link com.runnerfleet.core.error.WorkerNotFoundException}.
     */
    Mono<WorkerInfo> status(FleetConfig fleet, long workerId);
}
