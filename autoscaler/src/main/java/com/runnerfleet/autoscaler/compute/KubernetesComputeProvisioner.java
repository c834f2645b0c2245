package com.runnerfleet.autoscaler.compute;

import com.runnerfleet.core.error.ComputeProvisioningException;
import com.runnerfleet.core.model.ComputeHandle;
import com.runnerfleet.core.util.SecretRedactor;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Hosts each worker in its own Kubernetes pod.
 * <p>
 * Pods are labeled {@code app=runner-fleet} and {@code runner-fleet/fleet=<fleet>}, never
 * restart, and keep a long-running idle process so the runner can be installed and started
 * through pod exec. Destroying a worker deletes its pod.
 * </p>
 */
public class KubernetesComputeProvisioner implements IComputeProvisioner {
    private static final Logger log = LoggerFactory.getLogger(KubernetesComputeProvisioner.class);

    static final String APP_LABEL = "app";
    static final String APP_NAME = "runner-fleet";
    static final String FLEET_LABEL = "runner-fleet/fleet";
    static final String CONTAINER = "runner";

    private final KubernetesClient client;
    private final String namespace;
    private final String image;
    private final Duration readyTimeout;

    public KubernetesComputeProvisioner(String namespace, String image, Duration readyTimeout) {
        this(new KubernetesClientBuilder().build(), namespace, image, readyTimeout);
    }

    public KubernetesComputeProvisioner(KubernetesClient client, String namespace, String image,
                                        Duration readyTimeout) {
        this.client = client;
        this.namespace = namespace;
        this.image = image;
        this.readyTimeout = readyTimeout;
        log.info("Kubernetes compute provisioner initialized: namespace={}, image={}", namespace, image);
    }

    @Override
    public Mono<ComputeHandle> provision(ComputeSpec spec) {
        return Mono.fromCallable(() -> {
            Pod created;
            try {
                created = client.pods().inNamespace(namespace).resource(buildPod(spec)).create();
            } catch (Exception e) {
                throw new ComputeProvisioningException(
                    "Failed to create pod " + spec.getName() + ": " + SecretRedactor.describe(e), e);
            }

            Pod ready;
            try {
                ready = client.pods().inNamespace(namespace).withName(spec.getName())
                    .waitUntilReady(readyTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (Exception e) {
                log.warn("Pod {} did not become ready within {}s, deleting it",
                    spec.getName(), readyTimeout.toSeconds());
                deleteQuietly(spec.getName(), e);
                throw new ComputeProvisioningException(
                    "Pod " + spec.getName() + " not ready: " + SecretRedactor.describe(e), e);
            }

            Pod pod = ready != null ? ready : created;
            ComputeHandle handle = ComputeHandle.builder()
                .instanceId(pod.getMetadata().getUid())
                .name(spec.getName())
                .address(pod.getStatus() != null ? pod.getStatus().getPodIP() : null)
                .build();

            log.info("Pod {} ready for fleet {} (ip={})", handle.getName(), spec.getFleetName(), handle.getAddress());
            return handle;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> destroy(ComputeHandle handle) {
        return Mono.fromRunnable(() -> {
            try {
                client.pods().inNamespace(namespace).withName(handle.getName()).delete();
                log.info("Deleted pod {}", handle.getName());
            } catch (Exception e) {
                throw new ComputeProvisioningException(
                    "Failed to delete pod " + handle.getName() + ": " + SecretRedactor.describe(e), e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<CommandResult> runCommand(ComputeHandle handle, String script, Duration timeout) {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        return Mono.using(
                () -> client.pods().inNamespace(namespace).withName(handle.getName())
                    .inContainer(CONTAINER)
                    .writingOutput(stdout)
                    .writingError(stderr)
                    .exec("sh", "-c", script),
                (ExecWatch watch) -> Mono.fromFuture(watch.exitCode())
                    .timeout(timeout)
                    .map(exitCode -> new CommandResult(exitCode,
                        stdout.toString(StandardCharsets.UTF_8),
                        stderr.toString(StandardCharsets.UTF_8))),
                ExecWatch::close)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> !(e instanceof ComputeProvisioningException), e -> new ComputeProvisioningException(
                "Command on pod " + handle.getName() + " failed: " + SecretRedactor.describe(e), e));
    }

    Pod buildPod(ComputeSpec spec) {
        return new PodBuilder()
            .withNewMetadata()
                .withName(spec.getName())
                .withNamespace(namespace)
                .addToLabels(APP_LABEL, APP_NAME)
                .addToLabels(FLEET_LABEL, spec.getFleetName())
            .endMetadata()
            .withNewSpec()
                .withRestartPolicy("Never")
                .addNewContainer()
                    .withName(CONTAINER)
                    .withImage(image)
                    .withCommand("sleep", "infinity")
                .endContainer()
            .endSpec()
            .build();
    }

    private void deleteQuietly(String podName, Exception original) {
        try {
            client.pods().inNamespace(namespace).withName(podName).delete();
        } catch (Exception e) {
            original.addSuppressed(e);
            log.error("Failed to delete unready pod {}: {}", podName, SecretRedactor.describe(e));
        }
    }

    public void close() {
        client.close();
        log.info("Kubernetes compute provisioner closed");
    }
}
