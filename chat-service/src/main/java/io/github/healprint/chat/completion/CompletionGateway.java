package io.github.healprint.chat.completion;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.github.healprint.chat.context.CompletionPrompt;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Calls the text-completion service. Runs in fallback mode when no API key is configured. Errors
 * from the service are classified and turned into replies; nothing is thrown to callers.
 */
@ApplicationScoped
public class CompletionGateway {

    private static final Logger LOG = Logger.getLogger(CompletionGateway.class);

    static final double ANALYSIS_TEMPERATURE = 0.3;
    static final int ANALYSIS_MAX_TOKENS = 1500;

    private final ChatModel chatModel;
    private final FallbackReplies fallbackReplies;

    @Inject
    public CompletionGateway(
            @ConfigProperty(name = "healprint.completion.api-key") Optional<String> apiKey,
            @ConfigProperty(
                            name = "healprint.completion.base-url",
                            defaultValue = "https://openrouter.ai/api/v1")
                    String baseUrl,
            @ConfigProperty(name = "healprint.completion.model", defaultValue = "openai/gpt-4o-mini")
                    String modelName,
            @ConfigProperty(name = "healprint.completion.temperature", defaultValue = "0.7")
                    double temperature,
            @ConfigProperty(name = "healprint.completion.max-tokens", defaultValue = "500")
                    int maxTokens,
            @ConfigProperty(name = "healprint.completion.timeout", defaultValue = "PT60S")
                    Duration timeout,
            @ConfigProperty(name = "healprint.completion.site-url") Optional<String> siteUrl,
            @ConfigProperty(name = "healprint.completion.site-name", defaultValue = "HealPrint")
                    String siteName) {
        this(
                apiKey.filter(key -> !key.isBlank())
                        .map(
                                key ->
                                        buildModel(
                                                key,
                                                baseUrl,
                                                modelName,
                                                temperature,
                                                maxTokens,
                                                timeout,
                                                siteUrl.orElse(null),
                                                siteName))
                        .orElse(null),
                new FallbackReplies());
        if (chatModel == null) {
            LOG.warn("healprint.completion.api-key is not set - replies use fallback mode");
        } else {
            LOG.infof("Completion service configured: model=%s, baseUrl=%s", modelName, baseUrl);
        }
    }

    CompletionGateway(ChatModel chatModel, FallbackReplies fallbackReplies) {
        this.chatModel = chatModel;
        this.fallbackReplies = fallbackReplies;
    }

    public boolean isEnabled() {
        return chatModel != null;
    }

    /** Produces the assistant reply for a chat turn. */
    public CompletionReply complete(CompletionPrompt prompt, String latestUserMessage) {
        if (chatModel == null) {
            return CompletionReply.fallback(fallbackReplies.replyTo(latestUserMessage));
        }
        return call(ChatRequest.builder().messages(prompt.messages()).build(), "chat");
    }

    /** Produces a structured diagnostic analysis with a lower temperature and a larger budget. */
    public CompletionReply analyze(CompletionPrompt prompt) {
        if (chatModel == null) {
            return CompletionReply.failed(CompletionFailure.GENERIC);
        }
        ChatRequest request =
                ChatRequest.builder()
                        .messages(prompt.messages())
                        .parameters(
                                ChatRequestParameters.builder()
                                        .temperature(ANALYSIS_TEMPERATURE)
                                        .maxOutputTokens(ANALYSIS_MAX_TOKENS)
                                        .build())
                        .build();
        return call(request, "analysis");
    }

    private CompletionReply call(ChatRequest request, String purpose) {
        try {
            ChatResponse response = chatModel.chat(request);
            AiMessage message = response == null ? null : response.aiMessage();
            if (message == null || message.text() == null) {
                LOG.warnf("Completion service returned no text for %s request", purpose);
                return CompletionReply.failed(CompletionFailure.GENERIC);
            }
            return CompletionReply.of(message.text());
        } catch (RuntimeException e) {
            CompletionFailure failure = CompletionFailure.classify(e);
            LOG.warnf(e, "Completion %s request failed (%s)", purpose, failure.label());
            return CompletionReply.failed(failure);
        }
    }

    private static ChatModel buildModel(
            String apiKey,
            String baseUrl,
            String modelName,
            double temperature,
            int maxTokens,
            Duration timeout,
            String siteUrl,
            String siteName) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (siteUrl != null && !siteUrl.isBlank()) {
            headers.put("HTTP-Referer", siteUrl);
        }
        headers.put("X-Title", siteName);
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(timeout)
                .customHeaders(headers)
                .build();
    }
}
