package io.github.healprint.chat.conversation;

import io.github.healprint.chat.api.dto.ConversationDto;
import io.github.healprint.chat.api.dto.ConversationSummaryDto;
import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.model.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;

/** Maps conversation documents to and from the API model. */
final class ConversationDocuments {

    static final String CONVERSATION_ID = "conversation_id";
    static final String USER_ID = "user_id";
    static final String TITLE = "title";
    static final String MESSAGES = "messages";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";
    static final String ASSESSMENT_STAGE = "assessment_stage";
    static final String SYMPTOMS_COLLECTED = "symptoms_collected";
    static final String NEEDS_DIAGNOSIS = "needs_diagnosis";
    static final String LAST_MESSAGE = "last_message";

    static final int PREVIEW_LENGTH = 100;

    private ConversationDocuments() {}

    static Document byId(String conversationId) {
        return new Document(CONVERSATION_ID, conversationId);
    }

    static Document byUser(String userId) {
        return new Document(USER_ID, userId);
    }

    static Document newConversation(
            String conversationId, String userId, String title, Instant now) {
        Date timestamp = Date.from(now);
        return new Document(CONVERSATION_ID, conversationId)
                .append(USER_ID, userId)
                .append(TITLE, title)
                .append(MESSAGES, new ArrayList<Document>())
                .append(CREATED_AT, timestamp)
                .append(UPDATED_AT, timestamp)
                .append(ASSESSMENT_STAGE, AssessmentStage.INITIAL.toValue())
                .append(SYMPTOMS_COLLECTED, new Document())
                .append(NEEDS_DIAGNOSIS, false);
    }

    static Document toDocument(MessageDto message) {
        Document doc =
                new Document("role", message.getRole().toValue())
                        .append("content", message.getContent())
                        .append("timestamp", toDate(message.getTimestamp()));
        if (message.getMessageId() != null) {
            doc.append("message_id", message.getMessageId());
        }
        return doc;
    }

    static Document toDocument(Map<String, SymptomEvidence> symptoms) {
        Document doc = new Document();
        symptoms.forEach(
                (key, evidence) ->
                        doc.append(
                                key,
                                new Document("category", evidence.category())
                                        .append("mentioned", evidence.mentioned())));
        return doc;
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content;
    }

    static ConversationDto toConversation(Document doc) {
        ConversationDto dto = new ConversationDto();
        dto.setConversationId(doc.getString(CONVERSATION_ID));
        dto.setUserId(doc.getString(USER_ID));
        dto.setTitle(doc.getString(TITLE));
        dto.setMessages(toMessages(doc.getList(MESSAGES, Document.class)));
        Instant updatedAt = toInstant(doc.get(UPDATED_AT));
        Instant createdAt = toInstant(doc.get(CREATED_AT));
        dto.setUpdatedAt(updatedAt);
        dto.setCreatedAt(createdAt != null ? createdAt : updatedAt);
        AssessmentStage stage = AssessmentStage.fromString(doc.getString(ASSESSMENT_STAGE));
        dto.setAssessmentStage(stage != null ? stage : AssessmentStage.INITIAL);
        dto.setSymptomsCollected(toSymptoms(doc.get(SYMPTOMS_COLLECTED, Document.class)));
        dto.setNeedsDiagnosis(Boolean.TRUE.equals(doc.getBoolean(NEEDS_DIAGNOSIS)));
        return dto;
    }

    static ConversationSummaryDto toSummary(Document doc) {
        ConversationSummaryDto dto = new ConversationSummaryDto();
        dto.setConversationId(doc.getString(CONVERSATION_ID));
        dto.setTitle(doc.getString(TITLE));
        dto.setLastMessage(doc.getString(LAST_MESSAGE) != null ? doc.getString(LAST_MESSAGE) : "");
        List<Document> messages = doc.getList(MESSAGES, Document.class);
        dto.setMessageCount(messages == null ? 0 : messages.size());
        Instant updatedAt = toInstant(doc.get(UPDATED_AT));
        Instant createdAt = toInstant(doc.get(CREATED_AT));
        dto.setUpdatedAt(updatedAt);
        dto.setCreatedAt(createdAt != null ? createdAt : updatedAt);
        return dto;
    }

    private static List<MessageDto> toMessages(List<Document> docs) {
        List<MessageDto> messages = new ArrayList<>();
        if (docs == null) {
            return messages;
        }
        for (Document doc : docs) {
            messages.add(
                    new MessageDto(
                            MessageRole.fromString(doc.getString("role")),
                            doc.getString("content"),
                            toInstant(doc.get("timestamp")),
                            doc.getString("message_id")));
        }
        return messages;
    }

    private static Map<String, SymptomEvidence> toSymptoms(Document doc) {
        Map<String, SymptomEvidence> symptoms = new LinkedHashMap<>();
        if (doc == null) {
            return symptoms;
        }
        doc.forEach(
                (key, value) -> {
                    if (value instanceof Document evidence) {
                        symptoms.put(
                                key,
                                new SymptomEvidence(
                                        evidence.getString("category"),
                                        !Boolean.FALSE.equals(evidence.getBoolean("mentioned"))));
                    }
                });
        return symptoms;
    }

    static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Instant.parse(text);
        }
        return null;
    }
}
