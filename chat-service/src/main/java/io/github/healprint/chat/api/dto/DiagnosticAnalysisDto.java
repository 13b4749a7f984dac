package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.github.healprint.chat.assessment.HealthFactor;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DiagnosticAnalysisDto {

    private String conversationId;
    private String analysis;
    private Map<String, SymptomEvidence> symptomsAnalyzed;
    private List<HealthFactor> healthFactors;
    private String error;

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    public String getAnalysis() {
        return analysis;
    }

    public void setAnalysis(String analysis) {
        this.analysis = analysis;
    }

    public Map<String, SymptomEvidence> getSymptomsAnalyzed() {
        return symptomsAnalyzed;
    }

    public void setSymptomsAnalyzed(Map<String, SymptomEvidence> symptomsAnalyzed) {
        this.symptomsAnalyzed = symptomsAnalyzed;
    }

    public List<HealthFactor> getHealthFactors() {
        return healthFactors;
    }

    public void setHealthFactors(List<HealthFactor> healthFactors) {
        this.healthFactors = healthFactors;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
