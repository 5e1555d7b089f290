package io.github.drompincen.pocpilot.tools;

import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import io.github.drompincen.pocpilot.runtime.domain.PocDirectory;
import io.github.drompincen.pocpilot.runtime.domain.PocSummary;
import io.github.drompincen.pocpilot.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

import static io.github.drompincen.pocpilot.tools.PocJson.MAPPER;

public class ListMyActivePocsTool implements Tool {

    private PocDirectory pocDirectory;

    @Override public String name() { return AssistantTool.LIST_MY_ACTIVE_POCS.toolName(); }
    @Override public String description() { return "List the active POCs visible to the current user."; }
    @Override public JsonNode inputSchema() { return PocJson.emptySchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setPocDirectory(PocDirectory pocDirectory) {
        this.pocDirectory = pocDirectory;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (pocDirectory == null) return ToolResult.failure("PocDirectory not available");

        List<PocSummary> pocs = pocDirectory.activePocs(ctx.caller());
        ArrayNode arr = MAPPER.createArrayNode();
        for (PocSummary p : pocs) {
            arr.add(PocJson.poc(p));
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.set("pocs", arr);
        result.put("count", pocs.size());
        return ToolResult.success(result);
    }
}
