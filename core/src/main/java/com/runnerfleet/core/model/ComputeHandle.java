package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Reference to a compute instance created by the compute provisioner.
 */
@Value
@Builder(toBuilder = true)
public class ComputeHandle {
    /**
     * Provisioner-assigned identifier (for example a pod UID or VM resource id).
     */
    String instanceId;

    /**
     * Instance name, unique within the provisioner's scope.
     */
    String name;

    /**
     * Network address of the instance, if known.
     */
    String address;
}
