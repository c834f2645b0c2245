package com.runnerfleet.autoscaler.controller;

import com.runnerfleet.autoscaler.lifecycle.FleetLifecycleManager;
import com.runnerfleet.autoscaler.scale.ScaleDownSelector;
import com.runnerfleet.autoscaler.scale.ScalingPolicy;
import com.runnerfleet.autoscaler.support.EventLog;
import com.runnerfleet.autoscaler.support.FakeComputeProvisioner;
import com.runnerfleet.autoscaler.support.FakeQueueObserver;
import com.runnerfleet.autoscaler.support.FakeWorkerRegistry;
import com.runnerfleet.autoscaler.support.MutableClock;
import com.runnerfleet.autoscaler.support.RecordingEventPublisher;
import com.runnerfleet.core.error.QueueObservationException;
import com.runnerfleet.core.metrics.MetricsNames;
import com.runnerfleet.core.metrics.MetricsTags;
import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.FleetConfig;
import com.runnerfleet.core.model.ScalingAction;
import com.runnerfleet.core.model.ScalingConfig;
import com.runnerfleet.core.model.ScalingDecision;
import com.runnerfleet.core.model.WorkerStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Drives a fleet through its control loop with in-memory collaborators. Ticks are
 * triggered explicitly through {@code evaluateNow}; the scheduled interval is too long
 * to fire during a test.
 */
class FleetControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final Duration COOLDOWN = Duration.ofSeconds(60);

    private static final FleetConfig FLEET = FleetConfig.builder()
        .name("linux")
        .repoOwner("acme")
        .repoName("service")
        .label("self-hosted")
        .label("linux")
        .build();

    private static final ScalingConfig SCALING = ScalingConfig.builder()
        .minRunners(0)
        .maxRunners(5)
        .jobsPerRunner(1)
        .scaleUpThreshold(0)
        .scaleDownThreshold(0)
        .cooldown(COOLDOWN)
        .build();

    private EventLog log;
    private FakeComputeProvisioner compute;
    private FakeWorkerRegistry registry;
    private FakeQueueObserver queue;
    private RecordingEventPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private MutableClock clock;
    private FleetController controller;

    @BeforeEach
    void setUp() {
        log = new EventLog();
        compute = new FakeComputeProvisioner(log);
        registry = new FakeWorkerRegistry(log);
        queue = new FakeQueueObserver();
        publisher = new RecordingEventPublisher();
        meterRegistry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

        FleetLifecycleManager lifecycle = new FleetLifecycleManager(registry, compute, clock,
            Duration.ofSeconds(2), Duration.ofMillis(20), meterRegistry);
        controller = new FleetController(queue, new ScalingPolicy(clock), new ScaleDownSelector(), lifecycle,
            new OperationLimiter(4, meterRegistry), publisher, meterRegistry, clock, Duration.ofHours(1), 2);
    }

    @AfterEach
    void tearDown() {
        controller.shutdown().block(Duration.ofSeconds(10));
    }

    @Test
    void testScaleUp_WorkersBecomeActive() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 3;

        ScalingDecision decision = controller.evaluateNow("linux").block(WAIT);

        assertNotNull(decision);
        assertEquals(ScalingAction.SCALE_UP, decision.getAction());
        assertEquals(3, decision.getTargetRunnerCount());

        FleetStatus status = awaitStatus(s -> s.getActiveWorkers() == 3);
        assertEquals(3, status.getTrackedWorkers());
        assertEquals(3, compute.instances().size());
        assertEquals(3, registry.registeredIds().size());
        assertEquals(1, publisher.scaleSignals.size());
        assertFalse(publisher.scaleSignals.get(0).isManual());
        assertEquals(3.0, meterRegistry.get(MetricsNames.WORKERS_ACTIVE)
            .tag(MetricsTags.FLEET, "linux").gauge().value());
    }

    @Test
    void testQueueUnavailable_NoDecisionAndTickSkipped() {
        controller.enable(FLEET, SCALING);
        queue.fail = true;

        StepVerifier.create(controller.evaluateNow("linux"))
            .expectError(QueueObservationException.class)
            .verify(WAIT);

        FleetStatus status = controller.status("linux").orElseThrow();
        assertNull(status.getLastDecision());
        assertNull(status.getLastActionTime());
        assertEquals(0, status.getTrackedWorkers());
        assertEquals(1.0, meterRegistry.counter(MetricsNames.TICKS_SKIPPED_TOTAL,
            MetricsTags.FLEET, "linux", MetricsTags.REASON, "queue_unavailable").count());
    }

    @Test
    void testQueueUnavailable_WorkersLeftUntouched() throws InterruptedException {
        controller.enable(FLEET, SCALING.toBuilder().maxWorkerAge(Duration.ofHours(1)).build());
        queue.pendingJobs = 2;
        controller.evaluateNow("linux").block(WAIT);
        List<EphemeralWorker> workers = awaitStatus(s -> s.getActiveWorkers() == 2).getWorkers();
        long provisioned = countEvents("compute.provision:");

        // one worker dropped by the provider, the other past its maximum age
        registry.setOnline(workers.get(0).getWorkerId(), false);
        clock.advance(Duration.ofHours(2));
        queue.fail = true;

        StepVerifier.create(controller.evaluateNow("linux"))
            .expectError(QueueObservationException.class)
            .verify(WAIT);
        Thread.sleep(200);

        FleetStatus status = controller.status("linux").orElseThrow();
        assertEquals(2, status.getTrackedWorkers());
        assertEquals(2, status.getActiveWorkers());
        assertEquals(0, countEvents("compute.destroy:"));
        assertEquals(0, countEvents("registry.deregister:"));
        assertEquals(provisioned, countEvents("compute.provision:"));

        queue.fail = false;
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(s -> s.getWorkers().stream().noneMatch(w -> w.getName().equals(workers.get(0).getName())));
        assertEquals(1, log.count("compute.destroy:" + workers.get(0).getName()));
    }

    @Test
    void testCooldown_HoldsCurrentCountUntilElapsed() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 2;
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(s -> s.getActiveWorkers() == 2);

        queue.pendingJobs = 5;
        clock.advance(Duration.ofSeconds(30));
        ScalingDecision held = controller.evaluateNow("linux").block(WAIT);

        assertNotNull(held);
        assertEquals(ScalingAction.MAINTAIN, held.getAction());
        assertEquals(2, held.getTargetRunnerCount());
        assertTrue(held.getReason().startsWith("Cooldown active (30s of 60s"), held.getReason());

        clock.advance(Duration.ofSeconds(31));
        ScalingDecision resumed = controller.evaluateNow("linux").block(WAIT);

        assertNotNull(resumed);
        assertEquals(ScalingAction.SCALE_UP, resumed.getAction());
        assertEquals(5, resumed.getTargetRunnerCount());
        awaitStatus(s -> s.getActiveWorkers() == 5);
    }

    @Test
    void testScaleDown_RemovesIdleWorkersFirst() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 3;
        controller.evaluateNow("linux").block(WAIT);
        FleetStatus scaled = awaitStatus(s -> s.getActiveWorkers() == 3);

        EphemeralWorker busy = scaled.getWorkers().get(1);
        registry.setBusy(busy.getWorkerId(), true);
        queue.pendingJobs = 1;
        clock.advance(COOLDOWN);

        ScalingDecision decision = controller.evaluateNow("linux").block(WAIT);

        assertNotNull(decision);
        assertEquals(ScalingAction.SCALE_DOWN, decision.getAction());
        assertEquals(1, decision.getTargetRunnerCount());

        FleetStatus status = awaitStatus(s -> s.getTrackedWorkers() == 1);
        assertEquals(busy.getName(), status.getWorkers().get(0).getName());
        assertEquals(1, compute.instances().size());
        assertTrue(compute.instances().contains(busy.getName()));
    }

    @Test
    void testStatusUnavailable_WorkerTreatedAsBusy() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 2;
        controller.evaluateNow("linux").block(WAIT);
        FleetStatus scaled = awaitStatus(s -> s.getActiveWorkers() == 2);

        EphemeralWorker unknown = scaled.getWorkers().get(0);
        EphemeralWorker idle = scaled.getWorkers().get(1);
        registry.failStatus.add(unknown.getWorkerId());
        queue.pendingJobs = 1;
        clock.advance(COOLDOWN);

        controller.evaluateNow("linux").block(WAIT);

        FleetStatus status = awaitStatus(s -> s.getTrackedWorkers() == 1);
        assertEquals(unknown.getName(), status.getWorkers().get(0).getName());
        assertFalse(compute.instances().contains(idle.getName()));
    }

    @Test
    void testFinishedWorker_DestroyedAfterJob() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 1;
        controller.evaluateNow("linux").block(WAIT);
        EphemeralWorker worker = awaitStatus(s -> s.getActiveWorkers() == 1).getWorkers().get(0);

        registry.setBusy(worker.getWorkerId(), true);
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(s -> s.getWorkers().stream().anyMatch(EphemeralWorker::isBusy));

        // the ephemeral runner removes itself once its job is done
        registry.remove(worker.getWorkerId());
        queue.pendingJobs = 0;
        controller.evaluateNow("linux").block(WAIT);

        awaitStatus(s -> s.getTrackedWorkers() == 0);
        assertTrue(compute.instances().isEmpty());
        assertTrue(log.indexOf("compute.destroy:" + worker.getName()) >= 0);
    }

    @Test
    void testWorkerGoneWhileIdle_DestroyedAsUnhealthy() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 1;
        controller.evaluateNow("linux").block(WAIT);
        EphemeralWorker worker = awaitStatus(s -> s.getActiveWorkers() == 1).getWorkers().get(0);

        registry.setOnline(worker.getWorkerId(), false);
        controller.evaluateNow("linux").block(WAIT);

        awaitStatus(s -> s.getTrackedWorkers() == 0);
        assertEquals(1, log.count("registry.deregister:" + worker.getWorkerId()));
        assertEquals(1, log.count("compute.destroy:" + worker.getName()));
    }

    @Test
    void testProvisioningFailures_FleetDegradedThenRecovers() {
        controller.enable(FLEET, SCALING);
        compute.failProvision = true;
        queue.pendingJobs = 2;

        controller.evaluateNow("linux").block(WAIT);
        FleetStatus first = awaitStatus(s -> s.getConsecutiveFailedRounds() == 1);
        assertFalse(first.isDegraded());
        assertNotNull(first.getLastError());

        clock.advance(COOLDOWN);
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(FleetStatus::isDegraded);

        assertEquals(1, publisher.degraded.size());
        assertEquals(2, publisher.degraded.get(0).getConsecutiveFailedRounds());
        assertEquals(1.0, meterRegistry.get(MetricsNames.DEGRADED).tag(MetricsTags.FLEET, "linux").gauge().value());

        compute.failProvision = false;
        clock.advance(COOLDOWN);
        controller.evaluateNow("linux").block(WAIT);

        FleetStatus recovered = awaitStatus(s -> !s.isDegraded() && s.getActiveWorkers() == 2);
        assertEquals(0, recovered.getConsecutiveFailedRounds());
    }

    @Test
    void testManualScale_ClampedToMaximum() {
        controller.enable(FLEET, SCALING);

        ScalingDecision decision = controller.scaleTo("linux", 50).block(WAIT);

        assertNotNull(decision);
        assertEquals(ScalingAction.SCALE_UP, decision.getAction());
        assertEquals(5, decision.getTargetRunnerCount());
        assertTrue(decision.getReason().contains("clamped"));
        awaitStatus(s -> s.getActiveWorkers() == 5);
        assertTrue(publisher.scaleSignals.get(0).isManual());
    }

    @Test
    void testRotate_ReplacesWorker() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 1;
        controller.evaluateNow("linux").block(WAIT);
        EphemeralWorker old = awaitStatus(s -> s.getActiveWorkers() == 1).getWorkers().get(0);

        EphemeralWorker replacement = controller.rotateWorker("linux", old.getName()).block(WAIT);

        assertNotNull(replacement);
        assertNotEquals(old.getName(), replacement.getName());
        assertEquals(WorkerStatus.ACTIVE, replacement.getStatus());
        FleetStatus status = awaitStatus(s -> s.getTrackedWorkers() == 1
            && s.getWorkers().get(0).getName().equals(replacement.getName()));
        assertEquals(1, status.getActiveWorkers());
        assertFalse(compute.instances().contains(old.getName()));
    }

    @Test
    void testRotateUnknownWorker_NotFound() {
        controller.enable(FLEET, SCALING);

        StepVerifier.create(controller.rotateWorker("linux", "linux-runner-missing"))
            .expectError(NoSuchElementException.class)
            .verify(WAIT);
    }

    @Test
    void testAgedIdleWorker_RotatedOnTick() {
        controller.enable(FLEET, SCALING.toBuilder().maxWorkerAge(Duration.ofHours(1)).build());
        queue.pendingJobs = 1;
        controller.evaluateNow("linux").block(WAIT);
        EphemeralWorker old = awaitStatus(s -> s.getActiveWorkers() == 1).getWorkers().get(0);

        clock.advance(Duration.ofHours(2));
        controller.evaluateNow("linux").block(WAIT);

        FleetStatus status = awaitStatus(s -> s.getTrackedWorkers() == 1 && s.getActiveWorkers() == 1
            && !s.getWorkers().get(0).getName().equals(old.getName()));
        assertEquals(WorkerStatus.ACTIVE, status.getWorkers().get(0).getStatus());
        assertFalse(compute.instances().contains(old.getName()));
    }

    @Test
    void testUpdateScaling_VisibleInStatus() {
        controller.enable(FLEET, SCALING);
        ScalingConfig updated = SCALING.toBuilder().maxRunners(20).build();

        FleetStatus status = controller.updateScaling("linux", updated).block(WAIT);

        assertNotNull(status);
        assertEquals(20, status.getScaling().getMaxRunners());
        assertEquals(updated, controller.status("linux").orElseThrow().getScaling());
    }

    @Test
    void testDisableWithDrain_DestroysEveryWorker() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 2;
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(s -> s.getActiveWorkers() == 2);

        FleetStatus status = controller.disable("linux", true).block(WAIT);

        assertNotNull(status);
        assertTrue(status.isStopping());
        assertEquals(0, status.getTrackedWorkers());
        assertTrue(compute.instances().isEmpty());
        assertTrue(registry.registeredIds().isEmpty());
        assertTrue(controller.status("linux").isEmpty());
        assertNull(meterRegistry.find(MetricsNames.WORKERS).tag(MetricsTags.FLEET, "linux").gauge());
    }

    @Test
    void testDisableWithoutDrain_LeavesWorkersRunning() {
        controller.enable(FLEET, SCALING);
        queue.pendingJobs = 2;
        controller.evaluateNow("linux").block(WAIT);
        awaitStatus(s -> s.getActiveWorkers() == 2);

        FleetStatus status = controller.disable("linux", false).block(WAIT);

        assertNotNull(status);
        assertEquals(2, status.getTrackedWorkers());
        assertEquals(2, compute.instances().size());
        assertTrue(controller.statuses().isEmpty());
    }

    @Test
    void testEnableTwice_Rejected() {
        controller.enable(FLEET, SCALING);

        assertThrows(IllegalStateException.class, () -> controller.enable(FLEET, SCALING));
    }

    @Test
    void testUnknownFleet_NotFound() {
        assertTrue(controller.status("unknown").isEmpty());
        StepVerifier.create(controller.evaluateNow("unknown"))
            .expectError(NoSuchElementException.class)
            .verify(WAIT);
        StepVerifier.create(controller.disable("unknown", false))
            .expectError(NoSuchElementException.class)
            .verify(WAIT);
    }

    @Test
    void testStatuses_SortedByName() {
        controller.enable(FLEET.toBuilder().name("windows").build(), SCALING);
        controller.enable(FLEET, SCALING);

        assertEquals(List.of("linux", "windows"), controller.statuses().stream()
            .map(FleetStatus::getFleet)
            .collect(Collectors.toList()));
    }

    private FleetStatus awaitStatus(Predicate<FleetStatus> condition) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        FleetStatus status = null;
        while (System.nanoTime() < deadline) {
            status = controller.status("linux").orElseThrow();
            if (condition.test(status)) {
                return status;
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for fleet status");
            }
        }
        fail("Fleet status did not reach the expected state: " + status);
        return status;
    }

    private long countEvents(String prefix) {
        return log.events().stream().filter(e -> e.startsWith(prefix)).count();
    }
}
