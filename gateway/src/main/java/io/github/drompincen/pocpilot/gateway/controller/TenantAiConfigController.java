package io.github.drompincen.pocpilot.gateway.controller;

import io.github.drompincen.pocpilot.protocol.api.TenantAiConfigDto;
import io.github.drompincen.pocpilot.protocol.api.TenantAiConfigRequest;
import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.config.TenantAiConfigService;
import io.github.drompincen.pocpilot.runtime.security.AssistantAccessDeniedException;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Tenant assistant settings. Open to the tenant's own admin and to platform admins.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}/ai-config")
public class TenantAiConfigController {

    private final TenantAiConfigService configService;

    public TenantAiConfigController(TenantAiConfigService configService) {
        this.configService = configService;
    }

    @GetMapping
    public TenantAiConfigDto get(CallerIdentity caller, @PathVariable String tenantId) {
        requireAdmin(caller, tenantId);
        return configService.get(tenantId);
    }

    @PutMapping
    public ResponseEntity<TenantAiConfigDto> update(CallerIdentity caller, @PathVariable String tenantId,
                                                    @RequestBody TenantAiConfigRequest req) {
        requireAdmin(caller, tenantId);
        if (req == null || req.enabled() == null) {
            throw new IllegalArgumentException("'enabled' is required");
        }
        return ResponseEntity.ok(configService.set(tenantId, req.enabled(), req.credential()));
    }

    @DeleteMapping("/credential")
    public ResponseEntity<TenantAiConfigDto> clearCredential(CallerIdentity caller, @PathVariable String tenantId) {
        requireAdmin(caller, tenantId);
        return ResponseEntity.ok(configService.clearCredential(tenantId));
    }

    private static void requireAdmin(CallerIdentity caller, String tenantId) {
        boolean tenantAdmin = caller.role() == UserRole.TENANT_ADMIN && tenantId.equals(caller.tenantId());
        if (!tenantAdmin && caller.role() != UserRole.PLATFORM_ADMIN) {
            throw new AssistantAccessDeniedException("Only a Tenant Admin of this tenant can change AI settings.");
        }
    }
}
