package io.github.healprint.chat.context;

import dev.langchain4j.data.message.ChatMessage;
import java.util.List;

/** Role-tagged messages ready for the completion service, plus the context text they embed. */
public record CompletionPrompt(List<ChatMessage> messages, String contextText) {

    public CompletionPrompt {
        messages = List.copyOf(messages);
    }
}
