package io.github.drompincen.pocpilot.protocol.api;

/**
 * Partial update of a tenant's assistant settings. A null {@code credential} keeps
 * whatever is stored.
 */
public record TenantAiConfigRequest(
        Boolean enabled,
        String credential
) {}
