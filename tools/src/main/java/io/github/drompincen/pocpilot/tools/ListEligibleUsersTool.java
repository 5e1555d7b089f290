package io.github.drompincen.pocpilot.tools;

import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import io.github.drompincen.pocpilot.runtime.domain.PocDirectory;
import io.github.drompincen.pocpilot.runtime.domain.UserSummary;
import io.github.drompincen.pocpilot.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

import static io.github.drompincen.pocpilot.tools.PocJson.MAPPER;

public class ListEligibleUsersTool implements Tool {

    private PocDirectory pocDirectory;

    @Override public String name() { return AssistantTool.LIST_ELIGIBLE_USERS.toolName(); }
    @Override public String description() { return "List the active users of the organization who can work on POCs."; }
    @Override public JsonNode inputSchema() { return PocJson.emptySchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setPocDirectory(PocDirectory pocDirectory) {
        this.pocDirectory = pocDirectory;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (pocDirectory == null) return ToolResult.failure("PocDirectory not available");

        List<UserSummary> users = pocDirectory.eligibleUsers(ctx.caller());
        ArrayNode arr = MAPPER.createArrayNode();
        for (UserSummary u : users) {
            arr.add(PocJson.user(u));
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.set("users", arr);
        result.put("count", users.size());
        return ToolResult.success(result);
    }
}
