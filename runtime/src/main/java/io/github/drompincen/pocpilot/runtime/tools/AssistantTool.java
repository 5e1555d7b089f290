package io.github.drompincen.pocpilot.runtime.tools;

import java.util.Optional;

/**
 * The closed set of tools the assistant knows about. A tool implementation whose name is not
 * listed here is never registered.
 */
public enum AssistantTool {
    LIST_MY_ACTIVE_POCS("list_my_active_pocs"),
    LIST_POC_TASKS("list_poc_tasks"),
    LIST_ELIGIBLE_USERS("list_eligible_users"),
    GET_POC_SUMMARY("get_poc_summary");

    private final String toolName;

    AssistantTool(String toolName) {
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    public static Optional<AssistantTool> fromName(String name) {
        if (name == null) return Optional.empty();
        for (AssistantTool tool : values()) {
            if (tool.toolName.equals(name.trim())) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }
}
