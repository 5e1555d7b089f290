package io.github.drompincen.pocpilot.protocol.api;

public enum UserRole {
    PLATFORM_ADMIN,
    TENANT_ADMIN,
    ADMINISTRATOR,
    SALES_ENGINEER,
    ACCOUNT_EXECUTIVE,
    CUSTOMER;

    /**
     * External customers and platform-wide administrators never get the assistant,
     * whatever the tenant has configured.
     */
    public boolean isAssistantEligible() {
        return this != CUSTOMER && this != PLATFORM_ADMIN;
    }

    /** Roles that see every POC of their tenant, not only the ones they take part in. */
    public boolean seesWholeTenant() {
        return this == TENANT_ADMIN || this == ADMINISTRATOR;
    }

    public static UserRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        return UserRole.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
