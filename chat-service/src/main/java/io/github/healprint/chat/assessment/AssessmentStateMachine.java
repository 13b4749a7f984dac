package io.github.healprint.chat.assessment;

import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.model.MessageRole;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Map;

/**
 * Derives the assessment stage from the evidence and the number of assistant replies. The stage is
 * recomputed from scratch on every turn; it is not ratcheted, so corrected evidence can move it
 * back. {@link AssessmentStage#COMPLETED} is never produced here.
 */
@ApplicationScoped
public class AssessmentStateMachine {

    static final int DIAGNOSTIC_MIN_ASSISTANT_MESSAGES = 2;
    static final int DIAGNOSTIC_MIN_SYMPTOMS = 3;

    public AssessmentStage evaluate(int assistantMessages, int symptomCount) {
        if (assistantMessages >= DIAGNOSTIC_MIN_ASSISTANT_MESSAGES
                && symptomCount >= DIAGNOSTIC_MIN_SYMPTOMS) {
            return AssessmentStage.DIAGNOSTIC_READY;
        }
        if (symptomCount >= 1 || assistantMessages >= 1) {
            return AssessmentStage.GATHERING_INFO;
        }
        return AssessmentStage.INITIAL;
    }

    public AssessmentStage evaluate(
            List<MessageDto> messages, Map<String, SymptomEvidence> evidence) {
        return evaluate(countAssistantMessages(messages), evidence == null ? 0 : evidence.size());
    }

    public boolean needsDiagnosis(AssessmentStage stage) {
        return stage == AssessmentStage.DIAGNOSTIC_READY;
    }

    static int countAssistantMessages(List<MessageDto> messages) {
        if (messages == null) {
            return 0;
        }
        int count = 0;
        for (MessageDto message : messages) {
            if (message.getRole() == MessageRole.ASSISTANT) {
                count++;
            }
        }
        return count;
    }
}
