package io.github.drompincen.pocpilot.gateway.controller;

import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;
import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;
import io.github.drompincen.pocpilot.runtime.security.AssistantAccessDeniedException;
import io.github.drompincen.pocpilot.runtime.tools.ToolBridge;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assistant/tools")
public class ToolController {

    private final ToolBridge toolBridge;

    public ToolController(ToolBridge toolBridge) {
        this.toolBridge = toolBridge;
    }

    /** Tools the model is offered, i.e. the allow-listed ones. */
    @GetMapping
    public List<ToolDescriptor> list(CallerIdentity caller) {
        if (!caller.role().isAssistantEligible()) {
            throw new AssistantAccessDeniedException("AI Assistant is not available for your role.");
        }
        return toolBridge.descriptors();
    }
}
