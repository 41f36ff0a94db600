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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Decision backend for OpenAI-compatible chat-completions endpoints.
 *
 * <p>
 * Sends the system prompt, then one user message with the step context as text
 * and the screenshot as an inline PNG image part. JSON response mode is always
 * requested.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiDecisionBackend implements DecisionBackend {

    static final String BACKEND_ID = "openai";
    private static final String PREFIX = "openai/";

    private final PhoneAgentProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final DecisionResponseParser responseParser;
    private final ExecutorService phoneDecisionExecutor;

    private OpenAiChatApi client;
    private volatile boolean initialized = false;

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        PhoneAgentProperties.DecisionProperties decision = properties.getDecision();
        String baseUrl = decision.getOpenai().getBaseUrl();
        this.client = feignClientFactory.create(OpenAiChatApi.class, baseUrl, decision.getTimeoutMs());
        initialized = true;
        log.info("[Decision] OpenAI backend initialized with URL: {}", baseUrl);
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
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
            String apiKey = properties.getDecision().getOpenai().getApiKey();
            if (apiKey == null || apiKey.isBlank()) {
                throw new DecisionServiceException("OpenAI API key is not configured");
            }
            ensureInitialized();
            ChatCompletionResponse response;
            try {
                response = client.chatCompletion(apiKey, buildRequest(request));
            } catch (FeignException e) {
                log.warn("[Decision] OpenAI call failed with status {}", e.status());
                throw new DecisionServiceException("OpenAI request failed (HTTP " + e.status() + "): "
                        + e.getMessage(), e);
            }
            return convertResponse(response);
        }, phoneDecisionExecutor);
    }

    ChatCompletionRequest buildRequest(DecisionRequest request) {
        PhoneAgentProperties.DecisionProperties decision = properties.getDecision();

        List<ContentPart> parts = new ArrayList<>();
        parts.add(ContentPart.text(request.getStepContext()));
        if (request.getScreenshotBase64() != null && !request.getScreenshotBase64().isEmpty()) {
            parts.add(ContentPart.image("data:image/png;base64," + request.getScreenshotBase64(),
                    decision.getImageDetail()));
        }

        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(stripPrefix(decision.getModel()));
        apiRequest.setMessages(List.of(
                new ApiMessage("system", request.getSystemPrompt()),
                new ApiMessage("user", parts)));
        apiRequest.setResponseFormat(new ResponseFormat("json_object"));
        apiRequest.setTemperature(decision.getTemperature());
        apiRequest.setMaxCompletionTokens(decision.getMaxOutputTokens());
        return apiRequest;
    }

    private DecisionResult convertResponse(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new DecisionServiceException("OpenAI returned no choices");
        }
        Object content = response.getChoices().get(0).getMessage().getContent();
        int inputTokens = 0;
        int outputTokens = 0;
        if (response.getUsage() != null) {
            inputTokens = response.getUsage().getPromptTokens();
            outputTokens = response.getUsage().getCompletionTokens();
        }
        return responseParser.parse(content != null ? content.toString() : null, inputTokens, outputTokens);
    }

    private static String stripPrefix(String model) {
        return model.startsWith(PREFIX) ? model.substring(PREFIX.length()) : model;
    }

    // Feign API interface
    public interface OpenAiChatApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        @JsonProperty("response_format")
        private ResponseFormat responseFormat;
        private Double temperature;
        @JsonProperty("max_completion_tokens")
        private Integer maxCompletionTokens;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseFormat {
        private String type;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ApiMessage {
        private String role;
        // String for plain messages, list of ContentPart for multimodal ones
        private Object content;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContentPart {
        private String type;
        private String text;
        @JsonProperty("image_url")
        private ImageUrl imageUrl;

        static ContentPart text(String text) {
            return new ContentPart("text", text, null);
        }

        static ContentPart image(String url, String detail) {
            return new ContentPart("image_url", null, new ImageUrl(url, detail));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageUrl {
        private String url;
        private String detail;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
