package io.github.drompincen.pocpilot.protocol.api;

import java.time.Instant;

public record TenantAiConfigDto(
        String tenantId,
        boolean enabled,
        boolean hasCredential,
        Instant updatedAt
) {}
