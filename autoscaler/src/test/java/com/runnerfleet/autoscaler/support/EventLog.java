package com.runnerfleet.autoscaler.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of calls made on test doubles, shared so ordering across them can be asserted.
 */
public class EventLog {
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    public void record(String event) {
        events.add(event);
    }

    public List<String> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public int indexOf(String event) {
        return events().indexOf(event);
    }

    public long count(String event) {
        return events().stream().filter(event::equals).count();
    }
}
