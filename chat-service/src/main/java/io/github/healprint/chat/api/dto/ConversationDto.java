package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.healprint.chat.model.AssessmentStage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversationDto {

    private String conversationId;
    private String userId;
    private String title;
    private List<MessageDto> messages = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private AssessmentStage assessmentStage = AssessmentStage.INITIAL;
    private Map<String, SymptomEvidence> symptomsCollected = new LinkedHashMap<>();
    private boolean needsDiagnosis;

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<MessageDto> getMessages() {
        return messages;
    }

    public void setMessages(List<MessageDto> messages) {
        this.messages = messages != null ? messages : new ArrayList<>();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public AssessmentStage getAssessmentStage() {
        return assessmentStage;
    }

    public void setAssessmentStage(AssessmentStage assessmentStage) {
        this.assessmentStage = assessmentStage;
    }

    public Map<String, SymptomEvidence> getSymptomsCollected() {
        return symptomsCollected;
    }

    public void setSymptomsCollected(Map<String, SymptomEvidence> symptomsCollected) {
        this.symptomsCollected =
                symptomsCollected != null ? symptomsCollected : new LinkedHashMap<>();
    }

    public boolean isNeedsDiagnosis() {
        return needsDiagnosis;
    }

    public void setNeedsDiagnosis(boolean needsDiagnosis) {
        this.needsDiagnosis = needsDiagnosis;
    }
}
