package com.runnerfleet.autoscaler.compute;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Pod shape only; nothing here talks to a cluster.
 */
class KubernetesComputeProvisionerTest {

    private KubernetesClient client;
    private KubernetesComputeProvisioner provisioner;

    @BeforeEach
    void setUp() {
        client = new KubernetesClientBuilder()
            .withConfig(new ConfigBuilder().withMasterUrl("https://127.0.0.1:6443").build())
            .build();
        provisioner = new KubernetesComputeProvisioner(client, "ci-runners",
            "ghcr.io/actions/actions-runner:2.319.1", Duration.ofMinutes(2));
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void testPod_LabeledForFleetAndNeverRestarted() {
        Pod pod = provisioner.buildPod(ComputeSpec.builder()
            .name("linux-runner-1a2b3c4d")
            .fleetName("linux")
            .build());

        assertEquals("linux-runner-1a2b3c4d", pod.getMetadata().getName());
        assertEquals("ci-runners", pod.getMetadata().getNamespace());
        assertEquals(KubernetesComputeProvisioner.APP_NAME,
            pod.getMetadata().getLabels().get(KubernetesComputeProvisioner.APP_LABEL));
        assertEquals("linux", pod.getMetadata().getLabels().get(KubernetesComputeProvisioner.FLEET_LABEL));
        assertEquals("Never", pod.getSpec().getRestartPolicy());

        Container container = pod.getSpec().getContainers().get(0);
        assertEquals(KubernetesComputeProvisioner.CONTAINER, container.getName());
        assertEquals("ghcr.io/actions/actions-runner:2.319.1", container.getImage());
        assertEquals(List.of("sleep", "infinity"), container.getCommand());
    }
}
