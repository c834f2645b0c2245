package com.runnerfleet.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FleetConfigTest {

    @Test
    void testValidFleet() {
        FleetConfig fleet = FleetConfig.builder()
            .name("ci-workers")
            .repoOwner("testorg")
            .repoName("test.repo")
            .label("self-hosted")
            .label("linux")
            .runnerGroup("  ")
            .build();

        assertEquals("testorg/test.repo", fleet.getRepository());
        assertEquals(List.of("self-hosted", "linux"), fleet.getLabels());
        assertNull(fleet.getRunnerGroup(), "Blank runner group means provider default");
    }

    @Test
    void testInvalidRepositoryRejected() {
        assertThrows(IllegalArgumentException.class, () -> base().repoOwner("").build());
        assertThrows(IllegalArgumentException.class, () -> base().repoOwner("bad owner").build());
        assertThrows(IllegalArgumentException.class, () -> base().repoName("repo;rm -rf").build());
    }

    @Test
    void testLabelsValidated() {
        assertThrows(IllegalArgumentException.class, () -> base().clearLabels().build());
        assertThrows(IllegalArgumentException.class, () -> base().label("linux,docker").build());
    }

    @Test
    void testFleetNameMustBeDnsLabel() {
        assertThrows(IllegalArgumentException.class, () -> base().name("CI_Workers").build());
        assertThrows(IllegalArgumentException.class, () -> base().name("-ci").build());
        assertThrows(IllegalArgumentException.class, () -> base().name("a".repeat(41)).build());
        assertDoesNotThrow(() -> base().name("a".repeat(40)).build());
    }

    private FleetConfig.FleetConfigBuilder base() {
        return FleetConfig.builder()
            .name("ci")
            .repoOwner("testorg")
            .repoName("testrepo")
            .label("linux");
    }
}
