package io.github.healprint.chat.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.assessment.DiagnosticCatalog;
import io.github.healprint.chat.assessment.HealthFactor;
import io.github.healprint.chat.context.AssessmentContext.ExchangeKind;
import io.github.healprint.chat.context.AssessmentContext.LengthBucket;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.model.MessageRole;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns conversation history and evidence into a completion prompt. Pure: it never calls the
 * completion service.
 */
@ApplicationScoped
public class ContextSynthesizer {

    static final int HISTORY_WINDOW = 10;
    static final String INSTRUCTIONS_RESOURCE = "prompts/system-prompt.txt";

    private static final Pattern SELECTION_WORDS =
            Pattern.compile("option|choice|select|choose|[1-5]");
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final DiagnosticCatalog catalog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String instructions;

    @Inject
    public ContextSynthesizer(DiagnosticCatalog catalog, ObjectMapper objectMapper) {
        this(catalog, objectMapper, Clock.systemUTC());
    }

    ContextSynthesizer(DiagnosticCatalog catalog, ObjectMapper objectMapper, Clock clock) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.instructions = loadInstructions();
    }

    public AssessmentContext synthesize(
            List<MessageDto> history,
            Map<String, SymptomEvidence> evidence,
            AssessmentStage stage) {
        ExchangeKind exchange = ExchangeKind.NONE;
        List<String> options = List.of();
        boolean selecting = false;

        if (history.size() >= 2) {
            String lastAssistant = lastContent(history, MessageRole.ASSISTANT);
            String lastUser = lastContent(history, MessageRole.USER);
            if (lastAssistant != null && lastUser != null) {
                exchange = classify(lastAssistant);
                if (exchange == ExchangeKind.OPTIONS) {
                    options = optionLines(lastAssistant);
                }
                selecting = SELECTION_WORDS.matcher(lastUser.toLowerCase(Locale.ROOT)).find();
            }
        }

        return new AssessmentContext(
                stage,
                new ArrayList<>(evidence.keySet()),
                exchange,
                options,
                selecting,
                LengthBucket.forMessageCount(history.size()));
    }

    /** Builds the chat prompt: instructions and context first, then the recent history. */
    public CompletionPrompt buildPrompt(List<MessageDto> history, AssessmentContext context) {
        String contextText = context.render();
        StringBuilder system = systemPreamble();
        system.append("CONVERSATION CONTEXT: ").append(contextText).append("\n\n");
        if (context.lastExchange() == ExchangeKind.OPTIONS) {
            system.append(
                    "IMPORTANT: The user just responded to options you provided. Acknowledge"
                            + " their choice and ask follow-up questions about their"
                            + " selection.\n");
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(system.toString()));
        int from = Math.max(0, history.size() - HISTORY_WINDOW);
        for (MessageDto message : history.subList(from, history.size())) {
            if (message.getRole() == MessageRole.ASSISTANT) {
                messages.add(AiMessage.from(message.getContent()));
            } else {
                messages.add(UserMessage.from(message.getContent()));
            }
        }
        return new CompletionPrompt(messages, contextText);
    }

    public CompletionPrompt buildAnalysisPrompt(
            Map<String, SymptomEvidence> evidence,
            AssessmentStage stage,
            List<HealthFactor> factors) {
        String contextText =
                "Analysis Mode: " + stage.toValue() + " | Symptoms: " + evidence.keySet();
        StringBuilder system = systemPreamble();
        system.append("CONVERSATION CONTEXT: ").append(contextText).append("\n");

        String request =
                "Based on the collected symptoms and conversation, provide a comprehensive health"
                        + " analysis.\n\n"
                        + "Collected Symptoms:\n"
                        + toJson(evidence)
                        + "\n\nRelevant Health Factors:\n"
                        + toJson(factors)
                        + "\n\nPlease provide:\n"
                        + "1. Primary health concerns identified\n"
                        + "2. Likely root causes\n"
                        + "3. Confidence level (0-1)\n"
                        + "4. Specific recommendations\n"
                        + "5. Next steps\n"
                        + "6. Whether professional consultation is needed\n"
                        + "7. Suggested tests or evaluations\n\n"
                        + "Format your response as a structured analysis.";

        return new CompletionPrompt(
                List.of(SystemMessage.from(system.toString()), UserMessage.from(request)),
                contextText);
    }

    private StringBuilder systemPreamble() {
        StringBuilder system = new StringBuilder();
        system.append("Today Date: ")
                .append(DATE_FORMAT.format(LocalDate.now(clock)))
                .append("\n\n");
        system.append(instructions).append("\n\n");
        system.append(catalog.describeForPrompt()).append("\n");
        return system;
    }

    static ExchangeKind classify(String assistantText) {
        boolean hasDigit = assistantText.chars().anyMatch(Character::isDigit);
        if (hasDigit && (assistantText.contains(".") || assistantText.contains(":"))) {
            return ExchangeKind.OPTIONS;
        }
        return assistantText.contains("?") ? ExchangeKind.QUESTION : ExchangeKind.ADDITIONAL_INFO;
    }

    static List<String> optionLines(String assistantText) {
        List<String> options = new ArrayList<>();
        for (String line : assistantText.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (Character.isDigit(trimmed.charAt(0)) || line.contains(":")) {
                options.add(trimmed);
            }
        }
        return options;
    }

    private static String lastContent(List<MessageDto> history, MessageRole role) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getRole() == role) {
                return history.get(i).getContent();
            }
        }
        return null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper
                    .writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render analysis prompt", e);
        }
    }

    private static String loadInstructions() {
        try (InputStream in =
                ContextSynthesizer.class.getClassLoader().getResourceAsStream(INSTRUCTIONS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + INSTRUCTIONS_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
