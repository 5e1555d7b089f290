package io.github.drompincen.pocpilot.runtime.status;

/**
 * The assistant cannot run for this caller's tenant. The message is the guidance shown to
 * the user.
 */
public class AssistantConfigurationException extends RuntimeException {

    public AssistantConfigurationException(String message) {
        super(message);
    }
}
