package io.github.healprint.chat.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record HealthFactor(
        String factor,
        String impactLevel,
        List<String> relatedSymptoms,
        List<String> recommendations) {

    @JsonCreator
    public HealthFactor(
            @JsonProperty("factor") String factor,
            @JsonProperty("impact_level") String impactLevel,
            @JsonProperty("related_symptoms") List<String> relatedSymptoms,
            @JsonProperty("recommendations") List<String> recommendations) {
        this.factor = factor;
        this.impactLevel = impactLevel;
        this.relatedSymptoms = relatedSymptoms != null ? List.copyOf(relatedSymptoms) : List.of();
        this.recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    @JsonProperty("impact_level")
    @Override
    public String impactLevel() {
        return impactLevel;
    }

    @JsonProperty("related_symptoms")
    @Override
    public List<String> relatedSymptoms() {
        return relatedSymptoms;
    }

    public boolean relatesToAny(Iterable<String> symptoms) {
        for (String symptom : symptoms) {
            if (relatedSymptoms.contains(symptom)) {
                return true;
            }
        }
        return false;
    }
}
