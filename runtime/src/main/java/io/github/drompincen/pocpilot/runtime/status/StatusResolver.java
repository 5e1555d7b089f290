package io.github.drompincen.pocpilot.runtime.status;

import io.github.drompincen.pocpilot.protocol.api.AssistantStatusDto;
import io.github.drompincen.pocpilot.protocol.api.TenantAiConfigDto;
import io.github.drompincen.pocpilot.protocol.api.UserRole;
import io.github.drompincen.pocpilot.runtime.config.TenantAiConfigService;
import io.github.drompincen.pocpilot.runtime.security.AssistantAccessDeniedException;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.tools.ToolBridge;
import org.springframework.stereotype.Component;

@Component
public class StatusResolver {

    static final String NOT_AVAILABLE_FOR_ROLE = "AI Assistant is not available for your role.";
    static final String NO_TENANT = "No tenant context available.";
    static final String DISABLED_ADMIN = "AI Assistant is not enabled. Go to Settings to enable it.";
    static final String DISABLED_MEMBER = "AI Assistant is not enabled. Contact your Tenant Admin to enable it.";
    public static final String NO_CREDENTIAL = "AI Assistant is enabled but the model credential is not configured.";
    static final String NO_TOOLS = "AI Assistant is enabled but no assistant tools are configured.";
    static final String READY = "AI Assistant is ready to use.";

    private final TenantAiConfigService configService;
    private final ToolBridge toolBridge;

    public StatusResolver(TenantAiConfigService configService, ToolBridge toolBridge) {
        this.configService = configService;
        this.toolBridge = toolBridge;
    }

    public AssistantStatusDto resolve(CallerIdentity caller) {
        if (!caller.role().isAssistantEligible()) {
            return new AssistantStatusDto(false, false, NOT_AVAILABLE_FOR_ROLE);
        }
        if (!caller.hasTenant()) {
            return new AssistantStatusDto(false, false, NO_TENANT);
        }

        TenantAiConfigDto config = configService.get(caller.tenantId());
        if (!config.enabled()) {
            // only the tenant admin may learn whether a credential is stored
            return caller.role() == UserRole.TENANT_ADMIN
                    ? new AssistantStatusDto(false, config.hasCredential(), DISABLED_ADMIN)
                    : new AssistantStatusDto(false, false, DISABLED_MEMBER);
        }
        if (!config.hasCredential()) {
            return new AssistantStatusDto(true, false, NO_CREDENTIAL);
        }
        if (!toolBridge.hasTools()) {
            return new AssistantStatusDto(true, true, NO_TOOLS);
        }
        return new AssistantStatusDto(true, true, READY);
    }

    /** Passes only when a turn may start for this caller. */
    public void requireReady(CallerIdentity caller) {
        AssistantStatusDto status = resolve(caller);
        if (!caller.role().isAssistantEligible()) {
            throw new AssistantAccessDeniedException(status.message());
        }
        if (!READY.equals(status.message())) {
            throw new AssistantConfigurationException(status.message());
        }
    }
}
