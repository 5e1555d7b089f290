package io.github.drompincen.pocpilot.runtime.security;

import io.github.drompincen.pocpilot.protocol.api.UserRole;

import java.util.Objects;

/**
 * The authenticated user a request (and every tool call it triggers) runs as.
 */
public record CallerIdentity(
        String tenantId,
        String userId,
        UserRole role
) {
    public CallerIdentity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
    }

    public boolean hasTenant() {
        return tenantId != null && !tenantId.isBlank();
    }
}
