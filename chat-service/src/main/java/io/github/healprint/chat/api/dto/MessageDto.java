package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.healprint.chat.model.MessageRole;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageDto {

    private MessageRole role;
    private String content;
    private Instant timestamp;
    private String messageId;

    public MessageDto() {}

    public MessageDto(MessageRole role, String content, Instant timestamp, String messageId) {
        this.role = role;
        this.content = content;
        this.timestamp = timestamp;
        this.messageId = messageId;
    }

    public static MessageDto user(String content, Instant timestamp) {
        return new MessageDto(MessageRole.USER, content, timestamp, newMessageId());
    }

    public static MessageDto assistant(String content, Instant timestamp) {
        return new MessageDto(MessageRole.ASSISTANT, content, timestamp, newMessageId());
    }

    private static String newMessageId() {
        return "msg_" + UUID.randomUUID();
    }

    public MessageRole getRole() {
        return role;
    }

    public void setRole(MessageRole role) {
        this.role = role;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }
}
