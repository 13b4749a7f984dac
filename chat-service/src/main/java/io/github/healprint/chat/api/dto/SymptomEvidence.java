package io.github.healprint.chat.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Evidence recorded for one symptom key: the taxonomy category it belongs to. */
public record SymptomEvidence(String category, boolean mentioned) {

    @JsonCreator
    public SymptomEvidence(
            @JsonProperty("category") String category,
            @JsonProperty("mentioned") boolean mentioned) {
        this.category = category;
        this.mentioned = mentioned;
    }

    public static SymptomEvidence mentionedIn(String category) {
        return new SymptomEvidence(category, true);
    }
}
