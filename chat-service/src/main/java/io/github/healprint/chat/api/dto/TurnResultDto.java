package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.healprint.chat.model.AssessmentStage;
import java.util.Map;

/** Outcome of one chat turn: the assistant reply plus the assessment state after it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnResultDto {

    private String conversationId;
    private String messageId;
    private String response;
    private AssessmentStage assessmentStage;
    private Map<String, SymptomEvidence> symptomsCollected;
    private boolean needsDiagnosis;
    private String assistantReplyContext;
    private boolean fallbackMode;
    private String error;

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getResponse() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
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
        this.symptomsCollected = symptomsCollected;
    }

    public boolean isNeedsDiagnosis() {
        return needsDiagnosis;
    }

    public void setNeedsDiagnosis(boolean needsDiagnosis) {
        this.needsDiagnosis = needsDiagnosis;
    }

    public String getAssistantReplyContext() {
        return assistantReplyContext;
    }

    public void setAssistantReplyContext(String assistantReplyContext) {
        this.assistantReplyContext = assistantReplyContext;
    }

    public boolean isFallbackMode() {
        return fallbackMode;
    }

    public void setFallbackMode(boolean fallbackMode) {
        this.fallbackMode = fallbackMode;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
