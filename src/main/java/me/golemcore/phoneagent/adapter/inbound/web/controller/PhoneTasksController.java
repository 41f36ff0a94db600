package me.golemcore.phoneagent.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.phoneagent.domain.model.CancelResult;
import me.golemcore.phoneagent.domain.model.PhoneTask;
import me.golemcore.phoneagent.domain.model.StartTaskCommand;
import me.golemcore.phoneagent.domain.model.TaskResultSummary;
import me.golemcore.phoneagent.domain.service.PhoneTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Start, poll, list and cancel background phone runs.
 */
@RestController
@RequestMapping("/api/phone/tasks")
@RequiredArgsConstructor
public class PhoneTasksController {

    private static final int GOAL_PREVIEW_LENGTH = 100;

    private final PhoneTaskService phoneTaskService;

    @PostMapping
    public Mono<ResponseEntity<StartTaskResponse>> startTask(@RequestBody StartTaskRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        PhoneTask task = phoneTaskService.start(StartTaskCommand.builder()
                .goal(request.goal())
                .app(request.app())
                .parameters(request.parameters())
                .maxSteps(request.maxSteps())
                .build());
        StartTaskResponse response = new StartTaskResponse(task.getId(), task.getStatus().wireName(),
                "Task started. Poll /api/phone/tasks/" + task.getId() + " for progress.");
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
    }

    @GetMapping("/{taskId}")
    public Mono<ResponseEntity<TaskDto>> getTask(@PathVariable String taskId) {
        PhoneTask task = phoneTaskService.getStatus(taskId)
                .orElseThrow(() -> notFound(taskId));
        return Mono.just(ResponseEntity.ok(toDto(task)));
    }

    @GetMapping
    public Mono<ResponseEntity<TaskListResponse>> listTasks(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit) {
        List<TaskSummaryDto> tasks = phoneTaskService.list(status, limit).stream()
                .map(PhoneTasksController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(new TaskListResponse(tasks, tasks.size())));
    }

    @PostMapping("/{taskId}/cancel")
    public Mono<ResponseEntity<CancelResponse>> cancelTask(@PathVariable String taskId) {
        CancelResult result = phoneTaskService.cancel(taskId)
                .orElseThrow(() -> notFound(taskId));
        return Mono.just(ResponseEntity.ok(
                new CancelResponse(toDto(result.task()), result.cancelled(), result.message())));
    }

    private static ResponseStatusException notFound(String taskId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + taskId);
    }

    static TaskDto toDto(PhoneTask task) {
        return new TaskDto(
                task.getId(),
                task.getGoal(),
                task.getApp(),
                task.getParameters(),
                task.getStatus().wireName(),
                task.getMaxSteps(),
                task.getCurrentStep(),
                task.getStepsTaken(),
                task.getInputTokens(),
                task.getOutputTokens(),
                task.getTokensUsed(),
                task.getEstimatedCost(),
                task.getResult(),
                task.getError(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                task.getStartedAt(),
                task.getCompletedAt());
    }

    static TaskSummaryDto toSummary(PhoneTask task) {
        String goal = task.getGoal();
        if (goal != null && goal.length() > GOAL_PREVIEW_LENGTH) {
            goal = goal.substring(0, GOAL_PREVIEW_LENGTH) + "...";
        }
        return new TaskSummaryDto(
                task.getId(),
                goal,
                task.getApp(),
                task.getStatus().wireName(),
                task.getCurrentStep(),
                task.getMaxSteps(),
                task.getTokensUsed(),
                task.getEstimatedCost(),
                task.getCreatedAt(),
                task.getCompletedAt());
    }

    record StartTaskRequest(String goal, String app, Map<String, Object> parameters, Integer maxSteps) {
    }

    record StartTaskResponse(String taskId, String status, String message) {
    }

    record TaskDto(String id, String goal, String app, Map<String, Object> parameters, String status,
            int maxSteps, String currentStep, int stepsTaken, int inputTokens, int outputTokens, int tokensUsed,
            BigDecimal estimatedCost, TaskResultSummary result, String error, Instant createdAt,
            Instant updatedAt, Instant startedAt, Instant completedAt) {
    }

    record TaskSummaryDto(String id, String goal, String app, String status, String currentStep, int maxSteps,
            int tokensUsed, BigDecimal estimatedCost, Instant createdAt, Instant completedAt) {
    }

    record TaskListResponse(List<TaskSummaryDto> tasks, int count) {
    }

    record CancelResponse(TaskDto task, boolean cancelled, String message) {
    }
}
