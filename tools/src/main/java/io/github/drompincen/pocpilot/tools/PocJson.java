package io.github.drompincen.pocpilot.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.pocpilot.runtime.domain.PocSummary;
import io.github.drompincen.pocpilot.runtime.domain.TaskSummary;
import io.github.drompincen.pocpilot.runtime.domain.UserSummary;

import java.time.LocalDate;

/** JSON shapes shared by the POC tools. */
final class PocJson {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private PocJson() {}

    static ObjectNode poc(PocSummary p) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("pocId", p.pocId());
        n.put("title", p.title());
        n.put("customerCompanyName", p.customerCompanyName());
        n.put("status", p.status() != null ? p.status().name() : "UNKNOWN");
        n.put("startDate", date(p.startDate()));
        n.put("endDate", date(p.endDate()));
        if (p.overallSuccessScore() != null) {
            n.put("overallSuccessScore", p.overallSuccessScore());
        }
        return n;
    }

    static ObjectNode task(TaskSummary t) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("taskId", t.taskId());
        n.put("title", t.title());
        n.put("status", t.status() != null ? t.status().name() : "UNKNOWN");
        n.put("dueDate", date(t.dueDate()));
        var assignees = n.putArray("assigneeIds");
        t.assigneeIds().forEach(assignees::add);
        return n;
    }

    static ObjectNode user(UserSummary u) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("userId", u.userId());
        n.put("fullName", u.fullName());
        n.put("email", u.email());
        n.put("role", u.role() != null ? u.role().name() : null);
        return n;
    }

    static ObjectNode pocIdSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("pocId").put("type", "string").put("description", "Identifier of the POC");
        schema.putArray("required").add("pocId");
        return schema;
    }

    static ObjectNode emptySchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    private static String date(LocalDate d) {
        return d != null ? d.toString() : null;
    }
}
