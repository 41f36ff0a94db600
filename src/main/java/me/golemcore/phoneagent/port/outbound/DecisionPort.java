package me.golemcore.phoneagent.port.outbound;

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

import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the vision-capable model that picks the next phone action.
 * Implementations complete exceptionally with
 * {@link me.golemcore.phoneagent.domain.model.DecisionServiceException} when no
 * usable decision could be obtained.
 */
public interface DecisionPort {

    /**
     * Asks for the next action given the system prompt, the rendered step
     * context and the current screenshot.
     */
    CompletableFuture<DecisionResult> decide(DecisionRequest request);

    /**
     * Model identifier the port currently talks to.
     */
    String getModel();
}
