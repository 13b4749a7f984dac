package io.github.healprint.chat.completion;

import java.util.Locale;

/** Failure classes of the completion service, each with the reply shown to the user instead. */
public enum CompletionFailure {
    QUOTA(
            "API credits exhausted",
            "I'm currently unable to process your request due to API credit limitations. Please"
                    + " contact support or try again later. For immediate assistance, please reach"
                    + " out to our support team at support@healprint.xyz."),
    AUTHENTICATION(
            "API authentication failed",
            "I'm currently unable to process your request due to API authentication issues."
                    + " Please contact support at support@healprint.xyz."),
    GENERIC(
            "API error",
            "I apologize, I'm experiencing technical difficulties. Please try again later or"
                    + " contact support at support@healprint.xyz.");

    private final String label;
    private final String userMessage;

    CompletionFailure(String label, String userMessage) {
        this.label = label;
        this.userMessage = userMessage;
    }

    public String label() {
        return label;
    }

    public String userMessage() {
        return userMessage;
    }

    /** Classifies by the messages of {@code error} and its causes. */
    public static CompletionFailure classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String text = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (text.contains("402") || text.contains("credits")) {
                return QUOTA;
            }
            if (text.contains("401") || text.contains("unauthorized")) {
                return AUTHENTICATION;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return GENERIC;
    }
}
