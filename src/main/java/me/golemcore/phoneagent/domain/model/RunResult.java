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
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of a control-loop run. Produced once, never mutated.
 */
@Value
@Builder
public class RunResult {

    public static final String FINAL_ACTION_MAX_STEPS = "max_steps_reached";
    public static final String FINAL_ACTION_CANCELLED = "cancelled";

    boolean success;
    RunOutcome outcome;
    String finalAction;
    int stepsTaken;
    int inputTokens;
    int outputTokens;
    BigDecimal totalCost;
    List<StepRecord> steps;
    String error;
    Map<String, Object> extractedData;

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
