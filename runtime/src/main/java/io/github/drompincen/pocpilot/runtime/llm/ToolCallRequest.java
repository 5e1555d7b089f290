package io.github.drompincen.pocpilot.runtime.llm;

/** A tool invocation requested by the model. {@code argumentsJson} is passed through unparsed. */
public record ToolCallRequest(
        String id,
        String name,
        String argumentsJson
) {}
