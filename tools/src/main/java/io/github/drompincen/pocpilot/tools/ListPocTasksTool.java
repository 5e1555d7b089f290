package io.github.drompincen.pocpilot.tools;

import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import io.github.drompincen.pocpilot.runtime.domain.PocDirectory;
import io.github.drompincen.pocpilot.runtime.domain.TaskSummary;
import io.github.drompincen.pocpilot.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

import static io.github.drompincen.pocpilot.tools.PocJson.MAPPER;

public class ListPocTasksTool implements Tool {

    private PocDirectory pocDirectory;

    @Override public String name() { return AssistantTool.LIST_POC_TASKS.toolName(); }
    @Override public String description() { return "List the tasks of one POC, in plan order."; }
    @Override public JsonNode inputSchema() { return PocJson.pocIdSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setPocDirectory(PocDirectory pocDirectory) {
        this.pocDirectory = pocDirectory;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        if (pocDirectory == null) return ToolResult.failure("PocDirectory not available");
        String pocId = input.path("pocId").asText(null);
        if (pocId == null || pocId.isBlank()) return ToolResult.failure("'pocId' is required");

        if (pocDirectory.visiblePoc(ctx.caller(), pocId).isEmpty()) {
            return ToolResult.failure("POC not found: " + pocId);
        }
        List<TaskSummary> tasks = pocDirectory.tasks(ctx.caller(), pocId);
        ArrayNode arr = MAPPER.createArrayNode();
        for (TaskSummary t : tasks) {
            arr.add(PocJson.task(t));
        }
        ObjectNode result = MAPPER.createObjectNode();
        result.put("pocId", pocId);
        result.set("tasks", arr);
        result.put("count", tasks.size());
        return ToolResult.success(result);
    }
}
