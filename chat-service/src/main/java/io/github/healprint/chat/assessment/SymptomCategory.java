package io.github.healprint.chat.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One taxonomy category: a display name and its canonical, underscore-joined symptom keys. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SymptomCategory(String category, List<String> symptoms) {

    @JsonCreator
    public SymptomCategory(
            @JsonProperty("category") String category,
            @JsonProperty("symptoms") List<String> symptoms) {
        this.category = category;
        this.symptoms = symptoms != null ? List.copyOf(symptoms) : List.of();
    }
}
