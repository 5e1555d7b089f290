package io.github.drompincen.pocpilot.runtime.llm;

/**
 * One blocking round trip to the model service.
 */
public interface LlmClient {

    /**
     * @throws UpstreamException when the model service rejects the call or cannot be reached
     */
    ModelReply complete(ModelRequest request);
}
