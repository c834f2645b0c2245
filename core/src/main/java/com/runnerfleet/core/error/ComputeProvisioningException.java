package com.runnerfleet.core.error;

/**
 * The compute provisioner failed to create, destroy or reach an instance.
 */
public class ComputeProvisioningException extends ProvisioningException {
    public ComputeProvisioningException(String message) {
        super(message);
    }

    public ComputeProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
