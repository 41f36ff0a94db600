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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.phoneagent.domain.model.ActionType;
import me.golemcore.phoneagent.domain.model.Decision;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw model output into a {@link Decision}.
 *
 * <p>
 * Accepts bare JSON, JSON inside a Markdown code fence, or JSON surrounded by
 * prose (the outermost object is used).
 */
@Component
@RequiredArgsConstructor
public class DecisionResponseParser {

    private static final String FENCE = "```";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DecisionResult parse(String content, int inputTokens, int outputTokens) {
        if (content == null || content.isBlank()) {
            throw new DecisionServiceException("Empty response from decision service");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(content));
        } catch (JsonProcessingException e) {
            throw new DecisionServiceException("Invalid JSON from decision service: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecisionServiceException("Decision must be a JSON object");
        }

        JsonNode actionNode = root.get("action");
        if (actionNode == null || !actionNode.isTextual() || actionNode.asText().isBlank()) {
            throw new DecisionServiceException("Decision is missing the action field");
        }
        ActionType type;
        try {
            type = ActionType.fromWireName(actionNode.asText());
        } catch (IllegalArgumentException e) {
            throw new DecisionServiceException(e.getMessage(), e);
        }

        Map<String, Object> params = Map.of();
        JsonNode paramsNode = root.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            params = Collections.unmodifiableMap(objectMapper.convertValue(paramsNode, MAP_TYPE));
        }

        JsonNode doneNode = root.get("done");
        boolean done = doneNode != null && doneNode.asBoolean(false);
        JsonNode reasoningNode = root.get("reasoning");
        String reasoning = reasoningNode != null && !reasoningNode.isNull() ? reasoningNode.asText() : "";

        Decision decision = Decision.builder()
                .type(type)
                .params(params)
                .terminal(done || type == ActionType.DONE)
                .reasoning(reasoning)
                .build();
        return DecisionResult.builder()
                .decision(decision)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    static String extractJson(String content) {
        String text = content.trim();
        int fenceStart = text.indexOf(FENCE);
        if (fenceStart >= 0) {
            int bodyStart = text.indexOf('\n', fenceStart);
            int fenceEnd = bodyStart >= 0 ? text.indexOf(FENCE, bodyStart) : -1;
            if (bodyStart >= 0 && fenceEnd > bodyStart) {
                text = text.substring(bodyStart + 1, fenceEnd).trim();
            }
        }
        if (!text.startsWith("{")) {
            int open = text.indexOf('{');
            int close = text.lastIndexOf('}');
            if (open >= 0 && close > open) {
                text = text.substring(open, close + 1);
            }
        }
        return text;
    }
}
