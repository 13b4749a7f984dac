package io.github.healprint.chat.completion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.healprint.chat.context.CompletionPrompt;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class CompletionGatewayTest {

    private static final CompletionPrompt PROMPT =
            new CompletionPrompt(
                    List.of(SystemMessage.from("instructions"), UserMessage.from("I have acne")),
                    "Current Assessment Stage: gathering_info");

    @Test
    void returnsModelText() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenReturn(response("How long has it lasted?"));
        CompletionGateway gateway = new CompletionGateway(model, new FallbackReplies());

        CompletionReply reply = gateway.complete(PROMPT, "I have acne");

        assertEquals("How long has it lasted?", reply.text());
        assertFalse(reply.fallback());
        assertFalse(reply.failed());
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(request.capture());
        assertEquals(PROMPT.messages(), request.getValue().messages());
    }

    @Test
    void usesKeywordRepliesWithoutModel() {
        CompletionGateway gateway = new CompletionGateway(null, new FallbackReplies());

        CompletionReply reply = gateway.complete(PROMPT, "My SKIN is so oily");

        assertFalse(gateway.isEnabled());
        assertTrue(reply.fallback());
        assertEquals(FallbackReplies.SKIN, reply.text());
    }

    @Test
    void classifiesQuotaFailures() {
        CompletionReply reply =
                failingGateway(new RuntimeException("HTTP 402: Insufficient credits"))
                        .complete(PROMPT, "hi");

        assertEquals(CompletionFailure.QUOTA, reply.failure());
        assertEquals(CompletionFailure.QUOTA.userMessage(), reply.text());
        assertTrue(reply.text().contains("support@healprint.xyz"));
    }

    @Test
    void classifiesAuthenticationFailuresFromCause() {
        RuntimeException error =
                new RuntimeException("request failed", new IllegalStateException("Unauthorized"));

        CompletionReply reply = failingGateway(error).complete(PROMPT, "hi");

        assertEquals(CompletionFailure.AUTHENTICATION, reply.failure());
    }

    @Test
    void classifiesOtherFailuresAsGeneric() {
        CompletionReply reply =
                failingGateway(new RuntimeException("connect timed out")).complete(PROMPT, "hi");

        assertEquals(CompletionFailure.GENERIC, reply.failure());
        assertTrue(reply.text().contains("try again later"));
        assertFalse(reply.fallback());
    }

    @Test
    void analysisUsesLowTemperatureAndLargerBudget() {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenReturn(response("Primary concerns: ..."));
        CompletionGateway gateway = new CompletionGateway(model, new FallbackReplies());

        CompletionReply reply = gateway.analyze(PROMPT);

        assertEquals("Primary concerns: ...", reply.text());
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(request.capture());
        assertEquals(0.3, request.getValue().parameters().temperature());
        assertEquals(1500, request.getValue().parameters().maxOutputTokens());
    }

    @Test
    void analysisFailsWithoutModel() {
        CompletionReply reply = new CompletionGateway(null, new FallbackReplies()).analyze(PROMPT);

        assertTrue(reply.failed());
        assertEquals(CompletionFailure.GENERIC, reply.failure());
    }

    private static CompletionGateway failingGateway(RuntimeException error) {
        ChatModel model = mock(ChatModel.class);
        when(model.chat(any(ChatRequest.class))).thenThrow(error);
        return new CompletionGateway(model, new FallbackReplies());
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
