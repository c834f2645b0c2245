package com.runnerfleet.core.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Short-lived, single-use secret that binds one worker process to the CI provider.
 * <p>
 * Never persisted and never logged: the value is excluded from {@link #toString()}.
 * Its lifetime is bounded to the registration call that consumes it.
 * </p>
 */
@Value
@Builder
public class RegistrationToken {
    @ToString.Exclude
    String value;

    /**
     * Provider-defined expiry, typically at most one hour after issue.
     */
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
