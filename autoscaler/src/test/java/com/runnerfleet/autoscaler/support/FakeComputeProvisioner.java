package com.runnerfleet.autoscaler.support;

import com.runnerfleet.autoscaler.compute.CommandResult;
import com.runnerfleet.autoscaler.compute.ComputeSpec;
import com.runnerfleet.autoscaler.compute.IComputeProvisioner;
import com.runnerfleet.core.error.ComputeProvisioningException;
import com.runnerfleet.core.model.ComputeHandle;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory compute provisioner. Instances exist until destroyed.
 */
public class FakeComputeProvisioner implements IComputeProvisioner {
    private final EventLog log;
    private final Set<String> instances = ConcurrentHashMap.newKeySet();

    public volatile boolean failProvision;
    public volatile boolean failDestroy;
    public volatile CommandResult commandResult = new CommandResult(0, "", "");
    public volatile String lastScript;

    public FakeComputeProvisioner(EventLog log) {
        this.log = log;
    }

    @Override
    public Mono<ComputeHandle> provision(ComputeSpec spec) {
        return Mono.defer(() -> {
            log.record("compute.provision:" + spec.getName());
            if (failProvision) {
                return Mono.error(new ComputeProvisioningException("quota exceeded"));
            }
            instances.add(spec.getName());
            return Mono.just(ComputeHandle.builder()
                .instanceId("uid-" + spec.getName())
                .name(spec.getName())
                .address("10.0.0.1")
                .build());
        });
    }

    @Override
    public Mono<Void> destroy(ComputeHandle handle) {
        return Mono.defer(() -> {
            log.record("compute.destroy:" + handle.getName());
            if (failDestroy) {
                return Mono.error(new ComputeProvisioningException("delete failed"));
            }
            instances.remove(handle.getName());
            return Mono.empty();
        });
    }

    @Override
    public Mono<CommandResult> runCommand(ComputeHandle handle, String script, Duration timeout) {
        return Mono.fromCallable(() -> {
            log.record("compute.run:" + handle.getName());
            lastScript = script;
            return commandResult;
        });
    }

    public Set<String> instances() {
        return Set.copyOf(instances);
    }
}
