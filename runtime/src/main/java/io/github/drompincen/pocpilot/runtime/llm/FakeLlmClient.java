package io.github.drompincen.pocpilot.runtime.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Model stand-in for running without a model service. It always looks up the caller's active
 * POCs first and then answers from that tool result.
 *
 * Activate with: POCPILOT_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "pocpilot.llm.provider", havingValue = "fake")
public class FakeLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FIRST_TOOL = "list_my_active_pocs";

    @Override
    public ModelReply complete(ModelRequest request) {
        List<ModelMessage> messages = request.messages();
        ModelMessage last = messages.isEmpty() ? null : messages.get(messages.size() - 1);

        if (last != null && last.kind() == ModelMessage.Kind.TOOL_RESULT) {
            String answer = answerFrom(last.text());
            log.debug("[FAKE LLM] answering from {} result, length={}", last.toolName(), answer.length());
            return ModelReply.answer(answer);
        }

        boolean offered = request.tools().stream().map(ToolDescriptor::name).anyMatch(FIRST_TOOL::equals);
        if (offered) {
            log.debug("[FAKE LLM] requesting {}", FIRST_TOOL);
            return ModelReply.callTools(List.of(
                    new ToolCallRequest("call_" + UUID.randomUUID(), FIRST_TOOL, "{}")));
        }
        return ModelReply.answer("I don't have the information to answer that question.");
    }

    private static String answerFrom(String payload) {
        try {
            JsonNode node = MAPPER.readTree(payload);
            if (node.has("error")) {
                return "I could not look that up: " + node.path("error").asText();
            }
            JsonNode pocs = node.path("pocs");
            if (pocs.isArray() && pocs.isEmpty()) {
                return "You have no active POCs right now.";
            }
            StringBuilder sb = new StringBuilder("You have ").append(pocs.size()).append(" active POC(s):");
            for (JsonNode poc : pocs) {
                sb.append("\n- ").append(poc.path("title").asText());
                if (poc.hasNonNull("customerCompanyName")) {
                    sb.append(" (").append(poc.path("customerCompanyName").asText()).append(')');
                }
            }
            return sb.toString();
        } catch (Exception e) {
            log.debug("[FAKE LLM] unreadable tool payload: {}", e.getMessage());
            return "I received data I could not read.";
        }
    }
}
