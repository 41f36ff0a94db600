package me.golemcore.phoneagent.adapter.outbound.decision;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.phoneagent.domain.model.ActionType;
import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.infrastructure.config.AutoConfiguration;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.infrastructure.config.TaskRunConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnthropicDecisionBackendTest {

    private PhoneAgentProperties properties;
    private ChatModel chatModel;
    private ExecutorService decisionExecutor;
    private AnthropicDecisionBackend backend;

    @BeforeEach
    void setUp() {
        properties = new PhoneAgentProperties();
        properties.getDecision().setModel("claude-sonnet-4-20250514");
        properties.getDecision().setExecutorThreads(1);
        properties.getTasks().setRunThreads(4);
        decisionExecutor = new TaskRunConfiguration().phoneDecisionExecutor(properties);
        chatModel = mock(ChatModel.class);
        backend = new AnthropicDecisionBackend(properties,
                new DecisionResponseParser(AutoConfiguration.objectMapper()), decisionExecutor) {
            @Override
            ChatModel createChatModel() {
                return chatModel;
            }
        };
    }

    @AfterEach
    void tearDown() {
        decisionExecutor.shutdownNow();
    }

    @Test
    void shouldParseDecisionAndReportTokens() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("```json\n{\"action\":\"done\",\"params\":{\"mode\":\"heat\"}}\n```"))
                .tokenUsage(new TokenUsage(1200, 60))
                .build());

        DecisionResult result = backend.decide(request()).get(5, TimeUnit.SECONDS);

        assertEquals(ActionType.DONE, result.getDecision().getType());
        assertTrue(result.getDecision().isTerminal());
        assertEquals("heat", result.getDecision().stringParam("mode"));
        assertEquals(1200, result.getInputTokens());
        assertEquals(60, result.getOutputTokens());
    }

    @Test
    void shouldPutImageBeforeTextInUserTurn() {
        ChatRequest chatRequest = backend.buildRequest(request());

        assertEquals(2, chatRequest.messages().size());
        assertEquals("SYSTEM", ((SystemMessage) chatRequest.messages().get(0)).text());
        UserMessage user = (UserMessage) chatRequest.messages().get(1);
        assertEquals(2, user.contents().size());
        ImageContent image = (ImageContent) user.contents().get(0);
        assertEquals("aGVsbG8=", image.image().base64Data());
        assertEquals("image/png", image.image().mimeType());
        assertEquals(ImageContent.DetailLevel.LOW, image.detailLevel());
        assertEquals("CONTEXT", ((TextContent) user.contents().get(1)).text());
    }

    @Test
    void shouldWrapProviderFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("overloaded"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> backend.decide(request()).get(5, TimeUnit.SECONDS));

        assertInstanceOf(DecisionServiceException.class, error.getCause());
        assertEquals("Anthropic request failed: overloaded", error.getCause().getMessage());
    }

    @Test
    void shouldKeepOneDecisionInFlightPerRunThread() throws Exception {
        int runThreads = properties.getTasks().getRunThreads();
        CountDownLatch allInFlight = new CountDownLatch(runThreads);
        CountDownLatch release = new CountDownLatch(1);
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            allInFlight.countDown();
            release.await(10, TimeUnit.SECONDS);
            return ChatResponse.builder()
                    .aiMessage(AiMessage.from("{\"action\":\"wait\",\"params\":{}}"))
                    .tokenUsage(new TokenUsage(10, 2))
                    .build();
        });

        List<CompletableFuture<DecisionResult>> calls = new ArrayList<>();
        for (int i = 0; i < runThreads; i++) {
            calls.add(backend.decide(request()));
        }

        try {
            assertTrue(allInFlight.await(5, TimeUnit.SECONDS),
                    "every run thread should get its decision call executing");
        } finally {
            release.countDown();
        }
        for (CompletableFuture<DecisionResult> call : calls) {
            assertEquals(ActionType.WAIT, call.get(5, TimeUnit.SECONDS).getDecision().getType());
        }
    }

    @Test
    void shouldRequireApiKeyForRealModel() {
        AnthropicDecisionBackend unconfigured = new AnthropicDecisionBackend(properties,
                new DecisionResponseParser(AutoConfiguration.objectMapper()), decisionExecutor);

        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                unconfigured::createChatModel);

        assertEquals("Anthropic API key is not configured", error.getMessage());
    }

    private static DecisionRequest request() {
        return DecisionRequest.builder()
                .systemPrompt("SYSTEM")
                .stepContext("CONTEXT")
                .screenshotBase64("aGVsbG8=")
                .build();
    }
}
