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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A background phone run as seen by callers. Instances handed out by the store
 * are snapshots; mutating them has no effect on the stored task.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PhoneTask {

    private String id;
    private String goal;
    private String app;

    @Builder.Default
    private Map<String, Object> parameters = Map.of();

    private int maxSteps;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    /** Human-readable description of the latest step, e.g. {@code Step 3/20: tap}. */
    private String currentStep;
    private int stepsTaken;
    private int inputTokens;
    private int outputTokens;

    @Builder.Default
    private BigDecimal estimatedCost = BigDecimal.ZERO;

    private TaskResultSummary result;
    private String error;

    @JsonIgnore
    private boolean cancelRequested;

    public int getTokensUsed() {
        return inputTokens + outputTokens;
    }

    public PhoneTask snapshot() {
        return toBuilder().build();
    }
}
