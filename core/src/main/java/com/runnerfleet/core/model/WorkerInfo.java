package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Provider-side view of a registered worker. A read-only snapshot fetched on demand;
 * scaling decisions are driven by queue metrics, not by this.
 */
@Value
@Builder(toBuilder = true)
public class WorkerInfo {
    long workerId;
    String name;
    boolean online;
    boolean busy;
    List<String> labels;
}
