package io.github.drompincen.pocpilot.runtime.llm;

import java.util.List;

/**
 * One entry of the working context sent upstream. Tool traffic only lives here for the
 * duration of a turn; it never reaches the session history.
 */
public record ModelMessage(
        Kind kind,
        String text,
        List<ToolCallRequest> toolCalls,
        String toolCallId,
        String toolName
) {
    public enum Kind { USER, ASSISTANT, TOOL_RESULT }

    public static ModelMessage user(String text) {
        return new ModelMessage(Kind.USER, text, List.of(), null, null);
    }

    public static ModelMessage assistant(String text) {
        return new ModelMessage(Kind.ASSISTANT, text, List.of(), null, null);
    }

    public static ModelMessage toolCalls(String text, List<ToolCallRequest> calls) {
        return new ModelMessage(Kind.ASSISTANT, text != null ? text : "", List.copyOf(calls), null, null);
    }

    public static ModelMessage toolResult(ToolCallRequest call, String payload) {
        return new ModelMessage(Kind.TOOL_RESULT, payload, List.of(), call.id(), call.name());
    }
}
