package io.github.healprint.chat.service;

import io.github.healprint.chat.api.dto.AssessmentSummaryDto;
import io.github.healprint.chat.api.dto.ConversationDto;
import io.github.healprint.chat.api.dto.ConversationSummaryDto;
import io.github.healprint.chat.api.dto.DiagnosticAnalysisDto;
import io.github.healprint.chat.api.dto.MessageDto;
import io.github.healprint.chat.api.dto.SymptomEvidence;
import io.github.healprint.chat.api.dto.TurnResultDto;
import io.github.healprint.chat.assessment.AssessmentStateMachine;
import io.github.healprint.chat.assessment.DiagnosticCatalog;
import io.github.healprint.chat.assessment.HealthFactor;
import io.github.healprint.chat.assessment.SymptomExtractor;
import io.github.healprint.chat.completion.CompletionGateway;
import io.github.healprint.chat.completion.CompletionReply;
import io.github.healprint.chat.context.AssessmentContext;
import io.github.healprint.chat.context.CompletionPrompt;
import io.github.healprint.chat.context.ContextSynthesizer;
import io.github.healprint.chat.conversation.AssessmentDelta;
import io.github.healprint.chat.conversation.ConversationRepository;
import io.github.healprint.chat.model.AssessmentStage;
import io.github.healprint.chat.store.StoreUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Entry point for chat sessions. Every operation returns a {@link SessionResult}; store outages
 * and unexpected failures are reported through its status instead of being thrown.
 */
@ApplicationScoped
public class ConversationSessionEngine {

    private static final Logger LOG = Logger.getLogger(ConversationSessionEngine.class);

    static final String ANALYSIS_FAILED = "Analysis failed";

    private final ConversationRepository repository;
    private final SymptomExtractor extractor;
    private final AssessmentStateMachine stateMachine;
    private final ContextSynthesizer synthesizer;
    private final CompletionGateway gateway;
    private final DiagnosticCatalog catalog;
    private final Clock clock;

    @Inject
    public ConversationSessionEngine(
            ConversationRepository repository,
            SymptomExtractor extractor,
            AssessmentStateMachine stateMachine,
            ContextSynthesizer synthesizer,
            CompletionGateway gateway,
            DiagnosticCatalog catalog) {
        this(repository, extractor, stateMachine, synthesizer, gateway, catalog, Clock.systemUTC());
    }

    ConversationSessionEngine(
            ConversationRepository repository,
            SymptomExtractor extractor,
            AssessmentStateMachine stateMachine,
            ContextSynthesizer synthesizer,
            CompletionGateway gateway,
            DiagnosticCatalog catalog,
            Clock clock) {
        this.repository = repository;
        this.extractor = extractor;
        this.stateMachine = stateMachine;
        this.synthesizer = synthesizer;
        this.gateway = gateway;
        this.catalog = catalog;
        this.clock = clock;
    }

    public SessionResult<ConversationDto> getConversation(String conversationId) {
        return guarded(
                "getConversation",
                () ->
                        repository
                                .getConversation(conversationId)
                                .map(SessionResult::ok)
                                .orElseGet(() -> notFound(conversationId)));
    }

    public SessionResult<List<ConversationSummaryDto>> getUserConversations(String userId) {
        if (isBlank(userId)) {
            return SessionResult.invalid("user_id is required");
        }
        return guarded(
                "getUserConversations",
                () -> SessionResult.ok(repository.getUserConversations(userId)));
    }

    public SessionResult<ConversationDto> createConversation(String userId, String title) {
        if (isBlank(userId)) {
            return SessionResult.invalid("user_id is required");
        }
        return guarded(
                "createConversation",
                () -> SessionResult.ok(repository.createConversation(userId, title)));
    }

    public SessionResult<Boolean> deleteConversation(String conversationId) {
        return guarded(
                "deleteConversation",
                () ->
                        repository.deleteConversation(conversationId)
                                ? SessionResult.ok(true)
                                : notFound(conversationId));
    }

    /**
     * Runs one chat turn: records the user message, updates the assessment, asks the completion
     * service for a reply and records it. The user message and the reply are persisted in that
     * order.
     */
    public SessionResult<TurnResultDto> appendTurn(String conversationId, String userMessage) {
        if (isBlank(userMessage)) {
            return SessionResult.invalid("message is required");
        }
        return guarded("appendTurn", () -> runTurn(conversationId, userMessage));
    }

    public SessionResult<DiagnosticAnalysisDto> analyzeConversation(String conversationId) {
        return guarded("analyzeConversation", () -> runAnalysis(conversationId));
    }

    public SessionResult<AssessmentSummaryDto> summarizeConversation(String conversationId) {
        return guarded(
                "summarizeConversation",
                () -> {
                    Optional<ConversationDto> found = repository.getConversation(conversationId);
                    if (found.isEmpty()) {
                        return notFound(conversationId);
                    }
                    ConversationDto conversation = found.get();
                    List<MessageDto> messages = conversation.getMessages();
                    AssessmentSummaryDto summary = new AssessmentSummaryDto();
                    summary.setConversationId(conversation.getConversationId());
                    summary.setUserId(conversation.getUserId());
                    summary.setMessageCount(messages.size());
                    summary.setSymptomsCollected(conversation.getSymptomsCollected());
                    summary.setAssessmentStage(conversation.getAssessmentStage());
                    summary.setLastMessage(
                            messages.isEmpty() ? null : messages.get(messages.size() - 1));
                    return SessionResult.ok(summary);
                });
    }

    private SessionResult<TurnResultDto> runTurn(String conversationId, String userMessage) {
        Optional<ConversationDto> found = repository.getConversation(conversationId);
        if (found.isEmpty()) {
            return notFound(conversationId);
        }
        ConversationDto conversation = found.get();
        if (conversation.getAssessmentStage().isTerminal()) {
            return SessionResult.closed("Conversation " + conversationId + " is completed");
        }

        MessageDto userTurn = MessageDto.user(userMessage, now());
        Map<String, SymptomEvidence> evidence =
                extractor.merge(
                        conversation.getSymptomsCollected(), extractor.extract(userMessage));
        List<MessageDto> history = new ArrayList<>(conversation.getMessages());
        history.add(userTurn);

        AssessmentStage stage = stateMachine.evaluate(history, evidence);
        AssessmentContext context = synthesizer.synthesize(history, evidence, stage);
        CompletionPrompt prompt = synthesizer.buildPrompt(history, context);
        CompletionReply reply = gateway.complete(prompt, userMessage);

        if (reply.failed()) {
            return failedTurn(conversationId, userTurn, evidence, stage, context, reply);
        }

        MessageDto assistantTurn = MessageDto.assistant(reply.text(), now());
        history.add(assistantTurn);
        AssessmentStage next = stateMachine.evaluate(history, evidence);
        boolean needsDiagnosis = stateMachine.needsDiagnosis(next);

        if (!repository.updateConversation(
                conversationId, userTurn, AssessmentDelta.of(stage, evidence))) {
            return notFound(conversationId);
        }
        if (!repository.updateConversation(
                conversationId,
                assistantTurn,
                new AssessmentDelta(next, evidence, needsDiagnosis))) {
            return notFound(conversationId);
        }

        TurnResultDto result = new TurnResultDto();
        result.setConversationId(conversationId);
        result.setMessageId(assistantTurn.getMessageId());
        result.setResponse(reply.text());
        result.setAssessmentStage(next);
        result.setSymptomsCollected(evidence);
        result.setNeedsDiagnosis(needsDiagnosis);
        result.setAssistantReplyContext(context.render());
        result.setFallbackMode(reply.fallback());
        LOG.debugf(
                "Turn on %s: stage=%s, symptoms=%d, fallback=%s",
                conversationId, next.toValue(), evidence.size(), reply.fallback());
        return SessionResult.ok(result);
    }

    /**
     * Persists only the user message. The canned failure text is returned but never stored, and
     * the stage stays where the user message left it.
     */
    private SessionResult<TurnResultDto> failedTurn(
            String conversationId,
            MessageDto userTurn,
            Map<String, SymptomEvidence> evidence,
            AssessmentStage stage,
            AssessmentContext context,
            CompletionReply reply) {
        if (!repository.updateConversation(
                conversationId, userTurn, new AssessmentDelta(stage, evidence, false))) {
            return notFound(conversationId);
        }
        TurnResultDto result = new TurnResultDto();
        result.setConversationId(conversationId);
        result.setResponse(reply.text());
        result.setAssessmentStage(stage);
        result.setSymptomsCollected(evidence);
        result.setNeedsDiagnosis(false);
        result.setAssistantReplyContext(context.render());
        result.setFallbackMode(false);
        result.setError(reply.failure().label());
        LOG.warnf(
                "Turn on %s got no reply (%s); stage kept at %s",
                conversationId, reply.failure().label(), stage.toValue());
        return SessionResult.ok(result);
    }

    private SessionResult<DiagnosticAnalysisDto> runAnalysis(String conversationId) {
        Optional<ConversationDto> found = repository.getConversation(conversationId);
        if (found.isEmpty()) {
            return notFound(conversationId);
        }
        ConversationDto conversation = found.get();
        Map<String, SymptomEvidence> symptoms = conversation.getSymptomsCollected();
        if (symptoms.isEmpty()) {
            return SessionResult.invalid("No symptoms collected for analysis");
        }

        List<HealthFactor> factors = catalog.healthFactorsFor(symptoms.keySet());
        CompletionPrompt prompt =
                synthesizer.buildAnalysisPrompt(
                        symptoms, conversation.getAssessmentStage(), factors);
        CompletionReply reply = gateway.analyze(prompt);

        DiagnosticAnalysisDto analysis = new DiagnosticAnalysisDto();
        analysis.setConversationId(conversationId);
        analysis.setSymptomsAnalyzed(symptoms);
        analysis.setHealthFactors(factors);
        if (reply.failed()) {
            analysis.setError(ANALYSIS_FAILED + ": " + reply.failure().label());
        } else {
            analysis.setAnalysis(reply.text());
        }
        return SessionResult.ok(analysis);
    }

    private <T> SessionResult<T> guarded(String operation, Supplier<SessionResult<T>> call) {
        try {
            return call.get();
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "%s failed: conversation store unavailable", operation);
            return SessionResult.unavailable("Conversation store is unavailable");
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s failed unexpectedly", operation);
            return SessionResult.error("Unexpected error in " + operation);
        }
    }

    private static <T> SessionResult<T> notFound(String conversationId) {
        return SessionResult.notFound("Conversation " + conversationId + " not found");
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
