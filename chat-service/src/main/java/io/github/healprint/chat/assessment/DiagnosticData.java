package io.github.healprint.chat.assessment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Jackson view of {@code diagnostic-data.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagnosticData {

    @JsonProperty("symptom_categories")
    private Map<String, SymptomCategory> symptomCategories = new LinkedHashMap<>();

    @JsonProperty("health_factors")
    private Map<String, HealthFactor> healthFactors = new LinkedHashMap<>();

    @JsonProperty("diagnostic_patterns")
    private Map<String, Object> diagnosticPatterns = new LinkedHashMap<>();

    @JsonProperty("recommended_tests")
    private Map<String, List<String>> recommendedTests = new LinkedHashMap<>();

    public Map<String, SymptomCategory> getSymptomCategories() {
        return symptomCategories;
    }

    public void setSymptomCategories(Map<String, SymptomCategory> symptomCategories) {
        this.symptomCategories = symptomCategories;
    }

    public Map<String, HealthFactor> getHealthFactors() {
        return healthFactors;
    }

    public void setHealthFactors(Map<String, HealthFactor> healthFactors) {
        this.healthFactors = healthFactors;
    }

    public Map<String, Object> getDiagnosticPatterns() {
        return diagnosticPatterns;
    }

    public void setDiagnosticPatterns(Map<String, Object> diagnosticPatterns) {
        this.diagnosticPatterns = diagnosticPatterns;
    }

    public Map<String, List<String>> getRecommendedTests() {
        return recommendedTests;
    }

    public void setRecommendedTests(Map<String, List<String>> recommendedTests) {
        this.recommendedTests = recommendedTests;
    }
}
