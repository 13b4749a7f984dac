package io.github.healprint.chat.conversation;

import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.model.AssessmentStage;
import java.util.Map;

/**
 * Assessment fields written together with an appended message. A null component leaves the stored
 * value untouched.
 */
public record AssessmentDelta(
        AssessmentStage stage, Map<String, SymptomEvidence> symptoms, Boolean needsDiagnosis) {

    public static AssessmentDelta none() {
        return new AssessmentDelta(null, null, null);
    }

    public static AssessmentDelta of(
            AssessmentStage stage, Map<String, SymptomEvidence> symptoms) {
        return new AssessmentDelta(
                stage, symptoms, stage == null ? null : stage == AssessmentStage.DIAGNOSTIC_READY);
    }
}
