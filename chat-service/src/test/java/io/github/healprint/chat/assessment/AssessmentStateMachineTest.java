package io.github.healprint.chat.assessment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.model.AssessmentStage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AssessmentStateMachineTest {

    private final AssessmentStateMachine machine = new AssessmentStateMachine();

    @Test
    void followsStageTable() {
        assertEquals(AssessmentStage.INITIAL, machine.evaluate(0, 0));
        assertEquals(AssessmentStage.GATHERING_INFO, machine.evaluate(0, 1));
        assertEquals(AssessmentStage.GATHERING_INFO, machine.evaluate(1, 0));
        assertEquals(AssessmentStage.GATHERING_INFO, machine.evaluate(1, 5));
        assertEquals(AssessmentStage.GATHERING_INFO, machine.evaluate(5, 2));
        assertEquals(AssessmentStage.DIAGNOSTIC_READY, machine.evaluate(2, 3));
        assertEquals(AssessmentStage.DIAGNOSTIC_READY, machine.evaluate(7, 12));
    }

    @Test
    void neverProducesCompleted() {
        for (int assistant = 0; assistant < 10; assistant++) {
            for (int symptoms = 0; symptoms < 10; symptoms++) {
                assertNotEquals(AssessmentStage.COMPLETED, machine.evaluate(assistant, symptoms));
            }
        }
    }

    @Test
    void stageNeverRegressesWhileEvidenceGrows() {
        Random random = new Random(42);
        for (int walk = 0; walk < 500; walk++) {
            int assistant = 0;
            int symptoms = 0;
            AssessmentStage previous = machine.evaluate(assistant, symptoms);
            for (int turn = 0; turn < 12; turn++) {
                symptoms += 1 + random.nextInt(2);
                assistant += random.nextInt(2);
                AssessmentStage current = machine.evaluate(assistant, symptoms);
                assertTrue(
                        current.ordinal() >= previous.ordinal(),
                        "stage went from " + previous + " to " + current);
                previous = current;
            }
        }
    }

    @Test
    void recomputesFromCurrentEvidence() {
        assertEquals(AssessmentStage.DIAGNOSTIC_READY, machine.evaluate(2, 3));
        assertEquals(AssessmentStage.GATHERING_INFO, machine.evaluate(2, 2));
    }

    @Test
    void countsOnlyAssistantMessages() {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        List<MessageDto> messages =
                List.of(
                        MessageDto.user("I have acne", now),
                        MessageDto.assistant("How long?", now),
                        MessageDto.user("hair loss too", now),
                        MessageDto.assistant("Any fatigue?", now),
                        MessageDto.user("yes, fatigue", now));
        Map<String, SymptomEvidence> evidence =
                Map.of(
                        "acne", SymptomEvidence.mentionedIn("skin_conditions"),
                        "hair_loss", SymptomEvidence.mentionedIn("hair_conditions"),
                        "fatigue", SymptomEvidence.mentionedIn("internal_health"));

        AssessmentStage stage = machine.evaluate(messages, evidence);

        assertEquals(AssessmentStage.DIAGNOSTIC_READY, stage);
        assertTrue(machine.needsDiagnosis(stage));
        assertEquals(
                AssessmentStage.GATHERING_INFO, machine.evaluate(messages.subList(0, 3), evidence));
        assertFalse(machine.needsDiagnosis(AssessmentStage.GATHERING_INFO));
        assertEquals(AssessmentStage.INITIAL, machine.evaluate(List.of(), Map.of()));
    }
}
