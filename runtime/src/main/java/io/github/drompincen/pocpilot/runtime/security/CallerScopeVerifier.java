package io.github.drompincen.pocpilot.runtime.security;

import io.github.drompincen.pocpilot.persistence.repository.TenantUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-checks, at tool execution time, that the caller still holds the membership and role
 * the request was authenticated with. Tool calls never run with more than that.
 */
@Component
public class CallerScopeVerifier {

    private static final Logger log = LoggerFactory.getLogger(CallerScopeVerifier.class);

    private final TenantUserRepository tenantUserRepository;

    public CallerScopeVerifier(TenantUserRepository tenantUserRepository) {
        this.tenantUserRepository = tenantUserRepository;
    }

    public boolean isWithinScope(CallerIdentity caller) {
        if (caller == null || !caller.hasTenant() || !caller.role().isAssistantEligible()) {
            return false;
        }
        return tenantUserRepository.findByTenantIdAndUserId(caller.tenantId(), caller.userId())
                .filter(membership -> membership.isActive())
                .filter(membership -> membership.getRole() == caller.role())
                .map(membership -> true)
                .orElseGet(() -> {
                    log.warn("Caller {} has no active {} membership in tenant {}",
                            caller.userId(), caller.role(), caller.tenantId());
                    return false;
                });
    }
}
