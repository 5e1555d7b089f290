package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;

import java.util.List;

final class AssistantPrompts {

    private static final String GROUNDING_RULES = """
            You are the AI assistant of a POC (Proof of Concept) tracking product. You help users \
            find and understand information about their POCs.

            Follow every rule below without exception:
            1. Reply in the language the user writes in.
            2. Obtain data by calling the available tools before answering. Never guess or invent data; \
            every fact in your answer must come from a tool result.
            3. Never mention tool names, function signatures, argument JSON or internal details.
            4. Summarize tool results in plain language. Do not dump raw JSON.
            5. Call as many tools as the question needs.
            6. Never ask the user for identity, tenant or login details; the session already carries them.
            7. Only use tools from the AVAILABLE TOOLS list. Do not invent tool names.
            8. If no tool can answer the question, say so and explain what you can help with.
            9. Without a tool result, answer only: "I don't have the information to answer that question."
            10. Never make up names, email addresses, counts, percentages or dates.
            """;

    private AssistantPrompts() {}

    static String systemPrompt(List<ToolDescriptor> tools) {
        StringBuilder sb = new StringBuilder(GROUNDING_RULES);
        sb.append("\nAVAILABLE TOOLS:\n");
        for (ToolDescriptor tool : tools) {
            sb.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
        }
        return sb.toString();
    }
}
