package me.golemcore.phoneagent.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * One action chosen by the decision service for the current screen.
 */
@Data
@Builder
public class Decision {

    private ActionType type;

    @Builder.Default
    private Map<String, Object> params = Map.of();

    /**
     * True when the model reported the goal as done, or the action is
     * {@link ActionType#DONE}.
     */
    private boolean terminal;

    @Builder.Default
    private String reasoning = "";

    public Object param(String name) {
        return params != null ? params.get(name) : null;
    }

    public String stringParam(String name) {
        Object value = param(name);
        return value != null ? value.toString() : null;
    }
}
