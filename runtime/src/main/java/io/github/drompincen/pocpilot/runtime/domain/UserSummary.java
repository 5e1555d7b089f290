package io.github.drompincen.pocpilot.runtime.domain;

import io.github.drompincen.pocpilot.protocol.api.UserRole;

public record UserSummary(
        String userId,
        String fullName,
        String email,
        UserRole role
) {}
