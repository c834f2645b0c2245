package com.runnerfleet.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScalingConfigTest {

    @Test
    void testDefaults() {
        ScalingConfig config = ScalingConfig.defaults();

        assertEquals(0, config.getMinRunners());
        assertEquals(10, config.getMaxRunners());
        assertEquals(2, config.getJobsPerRunner());
        assertEquals(2, config.getScaleUpThreshold());
        assertEquals(0, config.getScaleDownThreshold());
        assertEquals(Duration.ofSeconds(300), config.getCooldown());
        assertFalse(config.isRotationEnabled());
    }

    @Test
    void testCustomValuesKeepUnsetDefaults() {
        ScalingConfig config = ScalingConfig.builder()
            .minRunners(2)
            .maxRunners(20)
            .jobsPerRunner(3)
            .build();

        assertEquals(2, config.getMinRunners());
        assertEquals(20, config.getMaxRunners());
        assertEquals(3, config.getJobsPerRunner());
        assertEquals(ScalingConfig.DEFAULT_SCALE_UP_THRESHOLD, config.getScaleUpThreshold());
        assertEquals(ScalingConfig.DEFAULT_COOLDOWN, config.getCooldown());
    }

    @Test
    void testMinGreaterThanMaxRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().minRunners(10).maxRunners(5).build());
    }

    @Test
    void testZeroJobsPerRunnerRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().jobsPerRunner(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().jobsPerRunner(-1).build());
    }

    @Test
    void testNegativeValuesRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().minRunners(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().scaleDownThreshold(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().cooldown(Duration.ofSeconds(-5)).build());
        assertThrows(IllegalArgumentException.class,
            () -> ScalingConfig.builder().maxWorkerAge(Duration.ofMinutes(-1)).build());
    }

    @Test
    void testClamp() {
        ScalingConfig config = ScalingConfig.builder().minRunners(1).maxRunners(4).build();

        assertEquals(1, config.clamp(0));
        assertEquals(3, config.clamp(3));
        assertEquals(4, config.clamp(50));
    }

    @Test
    void testToBuilderRevalidates() {
        ScalingConfig config = ScalingConfig.defaults();

        assertThrows(IllegalArgumentException.class,
            () -> config.toBuilder().maxRunners(-1).build());
        assertTrue(config.toBuilder().maxWorkerAge(Duration.ofHours(6)).build().isRotationEnabled());
    }
}
