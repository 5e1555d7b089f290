package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.protocol.api.AssistantErrorKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed user-facing text for each way a turn can fail. Nothing from the upstream response
 * ends up in these.
 */
public final class SyntheticReplies {

    /** Used when the model answered without any data behind it. */
    public static final String UNGROUNDED_ANSWER =
            "I was unable to retrieve the information you requested because I could not fetch data "
                    + "from the system. I can only answer from data retrieved through the platform. "
                    + "Please try rephrasing your question.";

    private static final Map<AssistantErrorKind, String> TEXT = new EnumMap<>(AssistantErrorKind.class);

    static {
        TEXT.put(AssistantErrorKind.CONFIGURATION,
                "The AI Assistant is not configured for your organization. Please contact your Tenant Admin.");
        TEXT.put(AssistantErrorKind.UPSTREAM_AUTH,
                "The AI service rejected your organization's credential. Please ask your Tenant Admin to update it in Settings.");
        TEXT.put(AssistantErrorKind.UPSTREAM_UNAVAILABLE,
                "The AI service is currently unavailable. Please try again in a moment.");
        TEXT.put(AssistantErrorKind.RATE_LIMITED,
                "The AI service is busy right now. Please wait a moment and try again.");
        TEXT.put(AssistantErrorKind.UPSTREAM_ERROR,
                "I'm sorry, I encountered an error processing your request. Please try again.");
        TEXT.put(AssistantErrorKind.SESSION_NOT_FOUND,
                "This chat has ended. Please start a new chat.");
        TEXT.put(AssistantErrorKind.TOOL_EXECUTION_FAILED,
                "I was unable to retrieve the information you requested because the data lookup failed. Please try again.");
        TEXT.put(AssistantErrorKind.TOOL_ROUNDS_EXCEEDED,
                "I could not complete your request within the allowed number of data lookups. Please ask a more specific question.");
    }

    private SyntheticReplies() {}

    public static String forKind(AssistantErrorKind kind) {
        return TEXT.get(kind);
    }
}
