package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;

import java.util.List;

public record ModelRequest(
        String credential,
        String systemPrompt,
        List<ModelMessage> messages,
        List<ToolDescriptor> tools
) {
    @Override
    public String toString() {
        // keep the credential out of logs
        return "ModelRequest[messages=" + messages.size() + ", tools=" + tools.size() + "]";
    }
}
