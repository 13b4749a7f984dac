package io.github.healprint.chat.completion;

/**
 * Text produced for a completion request. {@code fallback} marks canned text used because no
 * completion model is configured; {@code failure} is set when the model call failed.
 */
public record CompletionReply(String text, boolean fallback, CompletionFailure failure) {

    public static CompletionReply of(String text) {
        return new CompletionReply(text, false, null);
    }

    public static CompletionReply fallback(String text) {
        return new CompletionReply(text, true, null);
    }

    public static CompletionReply failed(CompletionFailure failure) {
        return new CompletionReply(failure.userMessage(), false, failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
