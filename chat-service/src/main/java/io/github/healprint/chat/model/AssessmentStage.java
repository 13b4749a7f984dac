package io.github.healprint.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of a health-assessment conversation. {@link #COMPLETED} is terminal and is only entered
 * when the user starts a newer conversation.
 */
public enum AssessmentStage {
    INITIAL,
    GATHERING_INFO,
    DIAGNOSTIC_READY,
    COMPLETED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AssessmentStage fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return AssessmentStage.valueOf(value.trim().toUpperCase());
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
