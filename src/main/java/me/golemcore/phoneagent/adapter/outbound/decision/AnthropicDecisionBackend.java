package me.golemcore.phoneagent.adapter.outbound.decision;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Decision backend for Claude models via langchain4j.
 *
 * <p>
 * The system prompt travels separately from the user turn, which carries the
 * screenshot as a base64 image followed by the step context.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnthropicDecisionBackend implements DecisionBackend {

    static final String BACKEND_ID = "anthropic";
    private static final String PREFIX = "anthropic/";

    private final PhoneAgentProperties properties;
    private final DecisionResponseParser responseParser;
    private final ExecutorService phoneDecisionExecutor;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        this.chatModel = createChatModel();
        initialized = true;
        log.info("[Decision] Anthropic backend initialized with model: {}", modelName());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    ChatModel createChatModel() {
        PhoneAgentProperties.DecisionProperties decision = properties.getDecision();
        PhoneAgentProperties.ProviderProperties config = decision.getAnthropic();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new DecisionServiceException("Anthropic API key is not configured");
        }
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName())
                .maxRetries(0)
                .maxTokens(decision.getMaxOutputTokens())
                .temperature(decision.getTemperature())
                .timeout(Duration.ofMillis(decision.getTimeoutMs()));

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public String getModel() {
        return properties.getDecision().getModel();
    }

    @Override
    public CompletableFuture<DecisionResult> decide(DecisionRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ChatResponse response;
            try {
                response = chatModel.chat(buildRequest(request));
            } catch (RuntimeException e) { // NOSONAR - provider errors surface as decision failures
                log.warn("[Decision] Anthropic call failed: {}", e.getMessage());
                throw new DecisionServiceException("Anthropic request failed: " + e.getMessage(), e);
            }
            if (response == null || response.aiMessage() == null) {
                throw new DecisionServiceException("Anthropic returned no message");
            }
            TokenUsage usage = response.tokenUsage();
            int inputTokens = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
            int outputTokens = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
            return responseParser.parse(response.aiMessage().text(), inputTokens, outputTokens);
        }, phoneDecisionExecutor);
    }

    ChatRequest buildRequest(DecisionRequest request) {
        List<Content> contents = new ArrayList<>();
        if (request.getScreenshotBase64() != null && !request.getScreenshotBase64().isEmpty()) {
            contents.add(ImageContent.from(request.getScreenshotBase64(), "image/png", detailLevel()));
        }
        contents.add(TextContent.from(request.getStepContext()));

        List<ChatMessage> messages = List.of(
                SystemMessage.from(request.getSystemPrompt()),
                UserMessage.from(contents));
        return ChatRequest.builder()
                .messages(messages)
                .build();
    }

    private ImageContent.DetailLevel detailLevel() {
        String detail = properties.getDecision().getImageDetail();
        try {
            return ImageContent.DetailLevel.valueOf(detail.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            return ImageContent.DetailLevel.LOW;
        }
    }

    private String modelName() {
        String model = properties.getDecision().getModel();
        return model.startsWith(PREFIX) ? model.substring(PREFIX.length()) : model;
    }
}
