package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;
import io.github.drompincen.pocpilot.protocol.api.ToolDescriptor;
import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Talks to an OpenAI-compatible chat endpoint (Ollama serves one under {@code /v1}) through
 * Spring AI. Each tenant brings its own credential, so a chat model is built per credential
 * and cached by its fingerprint.
 * <p>
 * Tool calls are not executed by Spring AI: the reply hands them back to the gateway, which
 * runs them through the tool bridge under the caller's identity.
 */
@Service
@ConditionalOnProperty(name = "pocpilot.llm.provider", havingValue = "openai", matchIfMissing = true)
public class SpringAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmClient.class);
    private static final int MAX_CACHED_MODELS = 256;

    private final AssistantProperties.Upstream upstream;
    private final Map<String, OpenAiChatModel> models = new ConcurrentHashMap<>();

    public SpringAiLlmClient(AssistantProperties properties) {
        this.upstream = properties.getUpstream();
        log.info("Model service at {} using model {}", upstream.getBaseUrl(), upstream.getModel());
    }

    @Override
    public ModelReply complete(ModelRequest request) {
        OpenAiChatModel model = modelFor(request.credential());
        Prompt prompt = new Prompt(toMessages(request), options(request.tools()));
        ChatResponse response;
        try {
            response = model.call(prompt);
        } catch (UpstreamException e) {
            throw e;
        } catch (ResourceAccessException e) {
            throw new UpstreamException(AssistantErrorKind.UPSTREAM_UNAVAILABLE,
                    "Model service unreachable: " + e.getClass().getSimpleName(), e);
        } catch (RuntimeException e) {
            throw new UpstreamException(AssistantErrorKind.UPSTREAM_ERROR,
                    "Model service call failed: " + e.getClass().getSimpleName(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new UpstreamException(AssistantErrorKind.UPSTREAM_ERROR, "Model service returned no output", null);
        }
        AssistantMessage output = response.getResult().getOutput();
        if (output.hasToolCalls()) {
            List<ToolCallRequest> calls = output.getToolCalls().stream()
                    .map(tc -> new ToolCallRequest(tc.id(), tc.name(), tc.arguments()))
                    .toList();
            return new ModelReply(output.getText() != null ? output.getText() : "", calls);
        }
        return ModelReply.answer(output.getText() != null ? output.getText() : "");
    }

    private OpenAiChatModel modelFor(String credential) {
        if (models.size() > MAX_CACHED_MODELS) {
            models.clear();
        }
        return models.computeIfAbsent(fingerprint(credential), k -> buildModel(credential));
    }

    private OpenAiChatModel buildModel(String credential) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(upstream.getConnectTimeout());
        requestFactory.setReadTimeout(upstream.getReadTimeout());

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(upstream.getBaseUrl())
                .apiKey(credential)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .responseErrorHandler(new UpstreamErrorHandler())
                .build();

        // the gateway decides about retries
        RetryTemplate singleAttempt = RetryTemplate.builder().maxAttempts(1).build();

        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(upstream.getModel())
                        .temperature(upstream.getTemperature())
                        .build())
                .retryTemplate(singleAttempt)
                .build();
    }

    private OpenAiChatOptions options(List<ToolDescriptor> tools) {
        List<ToolCallback> callbacks = tools.stream()
                .<ToolCallback>map(DeclaredTool::new)
                .toList();
        return OpenAiChatOptions.builder()
                .model(upstream.getModel())
                .temperature(upstream.getTemperature())
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .build();
    }

    private static List<Message> toMessages(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(request.systemPrompt()));
        for (ModelMessage m : request.messages()) {
            switch (m.kind()) {
                case USER -> messages.add(new UserMessage(m.text()));
                case ASSISTANT -> {
                    if (m.toolCalls().isEmpty()) {
                        messages.add(new AssistantMessage(m.text()));
                    } else {
                        List<AssistantMessage.ToolCall> calls = m.toolCalls().stream()
                                .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(), c.argumentsJson()))
                                .toList();
                        messages.add(new AssistantMessage(m.text(), Map.of(), calls));
                    }
                }
                case TOOL_RESULT -> messages.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(m.toolCallId(), m.toolName(), m.text()))));
            }
        }
        return messages;
    }

    static String fingerprint(String credential) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(credential.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Advertises a tool schema to the model. Execution happens in the gateway, so the callback
     * itself is never invoked.
     */
    private static final class DeclaredTool implements ToolCallback {

        private final ToolDefinition definition;

        DeclaredTool(ToolDescriptor descriptor) {
            this.definition = ToolDefinition.builder()
                    .name(descriptor.name())
                    .description(descriptor.description())
                    .inputSchema(descriptor.inputSchema() != null ? descriptor.inputSchema().toString() : "{\"type\":\"object\"}")
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the gateway");
        }
    }
}
