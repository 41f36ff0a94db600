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

import java.time.Instant;
import java.util.Map;

/**
 * One entry for the audit trail.
 */
@Data
@Builder
public class AuditEvent {

    public static final String STEP = "runner_step";
    public static final String COMPLETE = "runner_complete";
    public static final String ACTION_FAILED = "runner_action_failed";
    public static final String EXCEPTION = "runner_exception";
    public static final String MAX_STEPS = "runner_max_steps";
    public static final String CANCELLED = "runner_cancelled";

    private String event;
    private String taskId;
    private Integer stepNumber;
    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> data = Map.of();
}
