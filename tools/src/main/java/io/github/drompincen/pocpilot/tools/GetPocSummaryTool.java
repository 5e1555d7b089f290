package io.github.drompincen.pocpilot.tools;

import io.github.drompincen.pocpilot.protocol.api.TaskStatus;
import io.github.drompincen.pocpilot.protocol.api.ToolRiskProfile;
import io.github.drompincen.pocpilot.runtime.domain.PocDirectory;
import io.github.drompincen.pocpilot.runtime.domain.PocSummary;
import io.github.drompincen.pocpilot.runtime.domain.TaskSummary;
import io.github.drompincen.pocpilot.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

/**
 * One POC with its dates and how many of its tasks sit in each status.
 */
public class GetPocSummaryTool implements Tool {

    private PocDirectory pocDirectory;

    @Override public String name() { return AssistantTool.GET_POC_SUMMARY.toolName(); }
    @Override public String description() { return "Summarize one POC: status, dates and task counts by status."; }
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

        Optional<PocSummary> poc = pocDirectory.visiblePoc(ctx.caller(), pocId);
        if (poc.isEmpty()) return ToolResult.failure("POC not found: " + pocId);

        List<TaskSummary> tasks = pocDirectory.tasks(ctx.caller(), pocId);
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskSummary t : tasks) {
            if (t.status() != null) counts.merge(t.status(), 1, Integer::sum);
        }

        ObjectNode result = PocJson.poc(poc.get());
        ObjectNode byStatus = result.putObject("taskCountsByStatus");
        counts.forEach((status, count) -> byStatus.put(status.name(), count));
        result.put("taskCount", tasks.size());
        return ToolResult.success(result);
    }
}
