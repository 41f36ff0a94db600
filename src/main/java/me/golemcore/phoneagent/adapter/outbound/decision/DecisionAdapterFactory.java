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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DecisionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the decision backend from the configured model identifier.
 *
 * <p>
 * Models named {@code claude*} or prefixed {@code anthropic/} go to
 * {@link AnthropicDecisionBackend}; every other model is treated as
 * OpenAI-compatible and goes to {@link OpenAiDecisionBackend}.
 *
 * @see DecisionBackend
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class DecisionAdapterFactory implements DecisionPort {

    private final PhoneAgentProperties properties;
    private final List<DecisionBackend> backends;

    private final Map<String, DecisionBackend> backendsById = new ConcurrentHashMap<>();
    private DecisionBackend activeBackend;

    @PostConstruct
    public void init() {
        for (DecisionBackend backend : backends) {
            backendsById.put(backend.getBackendId(), backend);
            log.debug("Registered decision backend: {}", backend.getBackendId());
        }
        String model = properties.getDecision().getModel();
        String backendId = backendFor(model);
        activeBackend = backendsById.get(backendId);
        if (activeBackend == null) {
            log.warn("[Decision] No backend '{}' registered for model {}", backendId, model);
        } else {
            log.info("[Decision] Active backend: {} (model {})", backendId, model);
        }
    }

    /**
     * Backend id for a model identifier.
     */
    public static String backendFor(String model) {
        String normalized = model != null ? model.trim().toLowerCase(Locale.ROOT) : "";
        if (normalized.startsWith("claude") || normalized.startsWith(AnthropicDecisionBackend.BACKEND_ID + "/")) {
            return AnthropicDecisionBackend.BACKEND_ID;
        }
        return OpenAiDecisionBackend.BACKEND_ID;
    }

    public DecisionPort getActiveBackend() {
        return activeBackend;
    }

    @Override
    public CompletableFuture<DecisionResult> decide(DecisionRequest request) {
        if (activeBackend == null) {
            return CompletableFuture.failedFuture(
                    new DecisionServiceException("No decision backend available for model " + getModel()));
        }
        return activeBackend.decide(request);
    }

    @Override
    public String getModel() {
        return properties.getDecision().getModel();
    }
}
