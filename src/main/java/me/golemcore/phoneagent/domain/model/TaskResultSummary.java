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
import java.util.Map;

/**
 * Condensed run outcome stored on a finished task.
 */
@Value
@Builder
public class TaskResultSummary {

    boolean success;
    RunOutcome outcome;
    String finalAction;
    Map<String, Object> extractedData;
    int stepsTaken;
    int tokensUsed;
    BigDecimal estimatedCost;

    public static TaskResultSummary from(RunResult result) {
        return TaskResultSummary.builder()
                .success(result.isSuccess())
                .outcome(result.getOutcome())
                .finalAction(result.getFinalAction())
                .extractedData(result.getExtractedData())
                .stepsTaken(result.getStepsTaken())
                .tokensUsed(result.getTotalTokens())
                .estimatedCost(result.getTotalCost())
                .build();
    }
}
