package io.github.healprint.chat.context;

import io.github.healprint.chat.model.AssessmentStage;
import java.util.ArrayList;
import java.util.List;

/** Structured snapshot of where a conversation stands, rendered into the completion prompt. */
public record AssessmentContext(
        AssessmentStage stage,
        List<String> symptomKeys,
        ExchangeKind lastExchange,
        List<String> offeredOptions,
        boolean selectingOption,
        LengthBucket length) {

    static final int MAX_OPTIONS = 3;

    /** What the latest user message is answering. */
    public enum ExchangeKind {
        OPTIONS("User is responding to specific options/choices you provided"),
        QUESTION("User is responding to questions you asked"),
        ADDITIONAL_INFO("User is providing additional information"),
        NONE(null);

        private final String description;

        ExchangeKind(String description) {
            this.description = description;
        }
    }

    public enum LengthBucket {
        EARLY("Early stage - focus on gathering basic information"),
        MID("Mid-stage - dive deeper into specific symptoms"),
        ADVANCED("Advanced stage - ready for analysis or recommendations");

        private final String description;

        LengthBucket(String description) {
            this.description = description;
        }

        static LengthBucket forMessageCount(int count) {
            if (count <= 2) {
                return EARLY;
            }
            return count <= 6 ? MID : ADVANCED;
        }
    }

    public AssessmentContext {
        symptomKeys = List.copyOf(symptomKeys);
        offeredOptions =
                List.copyOf(offeredOptions.subList(0, Math.min(MAX_OPTIONS, offeredOptions.size())));
    }

    public String render() {
        List<String> parts = new ArrayList<>();
        parts.add("Current Assessment Stage: " + stage.toValue());
        if (!symptomKeys.isEmpty()) {
            parts.add("Identified Symptoms: " + String.join(", ", symptomKeys));
        }
        if (lastExchange != ExchangeKind.NONE) {
            parts.add("Previous Context: " + lastExchange.description);
            if (lastExchange == ExchangeKind.OPTIONS && !offeredOptions.isEmpty()) {
                parts.add("Options provided: " + String.join(" | ", offeredOptions));
            }
            if (selectingOption) {
                parts.add("User Response Type: Appears to be selecting from provided options");
            }
        }
        parts.add("Conversation Status: " + length.description);
        return String.join(" | ", parts);
    }
}
