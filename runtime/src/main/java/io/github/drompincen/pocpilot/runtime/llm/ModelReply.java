package io.github.drompincen.pocpilot.runtime.llm;

import java.util.List;

public record ModelReply(
        String text,
        List<ToolCallRequest> toolCalls
) {
    public static ModelReply answer(String text) {
        return new ModelReply(text, List.of());
    }

    public static ModelReply callTools(List<ToolCallRequest> calls) {
        return new ModelReply("", List.copyOf(calls));
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
