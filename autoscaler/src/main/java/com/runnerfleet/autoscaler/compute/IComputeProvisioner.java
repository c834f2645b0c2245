package com.runnerfleet.autoscaler.compute;

import com.runnerfleet.core.model.ComputeHandle;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Creates and destroys the compute instances that host workers.
 */
public interface IComputeProvisioner {

    /**
     * Creates an instance and completes once it can run commands.
     * Fails with {@link com.runnerfleet.core.error.ComputeProvisioningException}; a partially
     * created instance is cleaned up before the error is emitted.
     */
    Mono<ComputeHandle> provision(ComputeSpec spec);

    /**
     * Destroys an instance. Destroying an instance that no longer exists completes normally.
     */
    Mono<Void> destroy(ComputeHandle handle);

    /**
     * Runs a shell script on the instance. A non-zero exit code is a result, not an error;
     * only transport failures and timeouts fail the returned Mono.
     */
    Mono<CommandResult> runCommand(ComputeHandle handle, String script, Duration timeout);
}
