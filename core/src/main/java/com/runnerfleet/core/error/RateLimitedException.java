package com.runnerfleet.core.error;

import lombok.Getter;

/**
 * Provider answered with a rate-limit response (HTTP 429, or 403 with no remaining quota).
 * Retried with backoff before being surfaced as the caller's typed failure.
 */
@Getter
public class RateLimitedException extends ProvisioningException {
    private final int statusCode;

    public RateLimitedException(String operation, int statusCode) {
        super(operation + " rate limited by provider (HTTP " + statusCode + ")");
        this.statusCode = statusCode;
    }
}
