package com.runnerfleet.autoscaler.compute;

import lombok.Builder;
import lombok.Value;

/**
 * What to create for one worker.
 */
@Value
@Builder
public class ComputeSpec {
    /**
     * Instance name, identical to the worker name.
     */
    String name;

    String fleetName;
}
