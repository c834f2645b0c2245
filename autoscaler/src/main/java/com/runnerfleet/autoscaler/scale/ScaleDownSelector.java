package com.runnerfleet.autoscaler.scale;

import com.runnerfleet.core.model.EphemeralWorker;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the workers to remove on scale-down.
 */
public class ScaleDownSelector {

    /**
     * Idle before busy, then oldest first.
     */
    public static final Comparator<EphemeralWorker> OLDEST_IDLE_FIRST = Comparator
        .comparing(EphemeralWorker::isBusy)
        .thenComparing(EphemeralWorker::getCreatedAt)
        .thenComparing(EphemeralWorker::getName);

    private final Comparator<EphemeralWorker> order;

    public ScaleDownSelector() {
        this(OLDEST_IDLE_FIRST);
    }

    public ScaleDownSelector(Comparator<EphemeralWorker> order) {
        this.order = order;
    }

    /**
     * @param candidates workers eligible for removal, with up-to-date busy flags
     * @param count      how many to remove
     * @return at most {@code count} workers in removal order
     */
    public List<EphemeralWorker> select(Collection<EphemeralWorker> candidates, int count) {
        if (count <= 0) {
            return List.of();
        }
        return candidates.stream()
            .sorted(order)
            .limit(count)
            .collect(Collectors.toList());
    }
}
