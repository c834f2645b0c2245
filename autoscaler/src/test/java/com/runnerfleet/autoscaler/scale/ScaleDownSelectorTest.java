package com.runnerfleet.autoscaler.scale;

import com.runnerfleet.core.model.EphemeralWorker;
import com.runnerfleet.core.model.WorkerStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScaleDownSelectorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void testIdleBeforeBusy_OldestIdleFirst() {
        List<EphemeralWorker> workers = List.of(
            worker("busy-oldest", 0, true),
            worker("idle-new", 30, false),
            worker("idle-old", 10, false),
            worker("busy-new", 40, true));

        List<EphemeralWorker> selected = new ScaleDownSelector().select(workers, 3);

        assertEquals(List.of("idle-old", "idle-new", "busy-oldest"), names(selected));
    }

    @Test
    void testCountLargerThanCandidates_ReturnsAll() {
        List<EphemeralWorker> workers = List.of(worker("a", 0, false), worker("b", 1, false));

        assertEquals(2, new ScaleDownSelector().select(workers, 5).size());
        assertTrue(new ScaleDownSelector().select(workers, 0).isEmpty());
    }

    @Test
    void testCustomOrder_NewestFirst() {
        List<EphemeralWorker> workers = List.of(worker("old", 0, false), worker("new", 60, false));

        ScaleDownSelector newestFirst = new ScaleDownSelector(
            Comparator.comparing(EphemeralWorker::getCreatedAt).reversed());

        assertEquals(List.of("new"), names(newestFirst.select(workers, 1)));
    }

    private static EphemeralWorker worker(String name, long ageOffsetSeconds, boolean busy) {
        return EphemeralWorker.builder()
            .name(name)
            .fleetName("linux")
            .createdAt(T0.plusSeconds(ageOffsetSeconds))
            .busy(busy)
            .status(WorkerStatus.ACTIVE)
            .build();
    }

    private static List<String> names(List<EphemeralWorker> workers) {
        return workers.stream().map(EphemeralWorker::getName).collect(Collectors.toList());
    }
}
