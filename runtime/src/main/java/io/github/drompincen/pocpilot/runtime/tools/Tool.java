package io.github.drompincen.pocpilot.runtime.tools;

import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * A domain query the model may request mid-turn. Implementations are discovered through
 * {@link java.util.ServiceLoader} and receive their collaborators through public setters.
 */
public interface Tool {

    String name();

    String description();

    /** JSON schema of the arguments object. */
    JsonNode inputSchema();

    Set<ToolRiskProfile> riskProfiles();

    ToolResult execute(ToolContext ctx, JsonNode input);
}
