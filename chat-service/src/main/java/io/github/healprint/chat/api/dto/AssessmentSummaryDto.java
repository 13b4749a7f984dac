package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.healprint.chat.model.AssessmentStage;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AssessmentSummaryDto {

    private String conversationId;
    private String userId;
    private int messageCount;
    private Map<String, SymptomEvidence> symptomsCollected;
    private AssessmentStage assessmentStage;
    private MessageDto lastMessage;

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

    public int getMessageCount() {
        return messageCount;
    }

    public void setMessageCount(int messageCount) {
        this.messageCount = messageCount;
    }

    public Map<String, SymptomEvidence> getSymptomsCollected() {
        return symptomsCollected;
    }

    public void setSymptomsCollected(Map<String, SymptomEvidence> symptomsCollected) {
        this.symptomsCollected = symptomsCollected;
    }

    public AssessmentStage getAssessmentStage() {
        return assessmentStage;
    }

    public void setAssessmentStage(AssessmentStage assessmentStage) {
        this.assessmentStage = assessmentStage;
    }

    public MessageDto getLastMessage() {
        return lastMessage;
    }

    public void setLastMessage(MessageDto lastMessage) {
        this.lastMessage = lastMessage;
    }
}
