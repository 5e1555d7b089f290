package io.github.drompincen.pocpilot.runtime.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;
import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import io.github.drompincen.pocpilot.runtime.security.CallerScopeVerifier;
import io.github.drompincen.pocpilot.runtime.session.SessionIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The only way a turn reaches the domain. A call runs only if the tool is allow-listed,
 * its arguments parse and the caller still holds the membership the request was made with.
 * Failures come back as {@link ToolResult#failure}; nothing thrown by a tool escapes.
 */
@Component
public class ToolBridge {

    private static final Logger log = LoggerFactory.getLogger(ToolBridge.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolRegistry registry;
    private final CallerScopeVerifier scopeVerifier;
    private final Set<AssistantTool> allowList;

    public ToolBridge(ToolRegistry registry, CallerScopeVerifier scopeVerifier, AssistantProperties properties) {
        this.registry = registry;
        this.scopeVerifier = scopeVerifier;
        this.allowList = EnumSet.noneOf(AssistantTool.class);
        for (String name : properties.getTools()) {
            Optional<AssistantTool> tool = AssistantTool.fromName(name);
            if (tool.isPresent()) {
                allowList.add(tool.get());
            } else {
                log.warn("Ignoring unknown tool '{}' in pocpilot.assistant.tools", name);
            }
        }
    }

    /** Allow-listed tools that are actually registered, in catalog order. */
    public List<Tool> availableTools() {
        return registry.all().stream()
                .filter(t -> AssistantTool.fromName(t.name()).map(allowList::contains).orElse(false))
                .sorted(Comparator.comparing(t -> AssistantTool.fromName(t.name()).orElseThrow()))
                .toList();
    }

    public boolean hasTools() {
        return !availableTools().isEmpty();
    }

    public List<ToolDescriptor> descriptors() {
        return availableTools().stream()
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema(), t.riskProfiles()))
                .toList();
    }

    public ToolResult invoke(String toolName, String argumentsJson, ToolContext ctx) {
        Optional<Tool> tool = AssistantTool.fromName(toolName)
                .filter(allowList::contains)
                .flatMap(t -> registry.get(t.toolName()));
        if (tool.isEmpty()) {
            log.warn("Session {} requested unavailable tool '{}'", SessionIds.abbreviate(ctx.sessionId()), toolName);
            return ToolResult.failure("Tool '" + toolName + "' is not available");
        }

        JsonNode input;
        try {
            input = argumentsJson == null || argumentsJson.isBlank()
                    ? MAPPER.createObjectNode()
                    : MAPPER.readTree(argumentsJson);
        } catch (JsonProcessingException e) {
            log.warn("Malformed arguments for tool {} in session {}", toolName, SessionIds.abbreviate(ctx.sessionId()));
            return ToolResult.failure("Arguments for '" + toolName + "' are not valid JSON");
        }
        if (!input.isObject()) {
            return ToolResult.failure("Arguments for '" + toolName + "' must be a JSON object");
        }

        try {
            if (!scopeVerifier.isWithinScope(ctx.caller())) {
                return ToolResult.failure("The caller is not permitted to run '" + toolName + "'");
            }
            ToolResult result = tool.get().execute(ctx, input);
            if (result == null) {
                return ToolResult.failure("Tool '" + toolName + "' returned no result");
            }
            log.debug("Tool {} for session {} -> success={}", toolName,
                    SessionIds.abbreviate(ctx.sessionId()), result.success());
            return result;
        } catch (RuntimeException e) {
            log.error("Tool {} failed in session {}", toolName, SessionIds.abbreviate(ctx.sessionId()), e);
            return ToolResult.failure("Tool '" + toolName + "' failed");
        }
    }

    /** What the model gets back for a tool call. */
    public static String toModelPayload(ToolResult result) {
        try {
            if (result.success()) {
                return MAPPER.writeValueAsString(result.output() != null ? result.output() : MAPPER.createObjectNode());
            }
            return MAPPER.writeValueAsString(MAPPER.createObjectNode().put("error", result.error()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool result", e);
        }
    }
}
