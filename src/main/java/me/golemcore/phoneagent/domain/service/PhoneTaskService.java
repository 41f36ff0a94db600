package me.golemcore.phoneagent.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.loop.PhoneControlLoop;
import me.golemcore.phoneagent.domain.loop.RunMonitor;
import me.golemcore.phoneagent.domain.model.CancelResult;
import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.domain.model.PhoneTask;
import me.golemcore.phoneagent.domain.model.RunOutcome;
import me.golemcore.phoneagent.domain.model.RunRequest;
import me.golemcore.phoneagent.domain.model.RunResult;
import me.golemcore.phoneagent.domain.model.StartTaskCommand;
import me.golemcore.phoneagent.domain.model.StepRecord;
import me.golemcore.phoneagent.domain.model.TaskResultSummary;
import me.golemcore.phoneagent.domain.model.TaskStatus;
import me.golemcore.phoneagent.domain.model.TaskUpdate;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Starts phone runs in the background and exposes their lifecycle.
 *
 * <p>
 * {@link #start} validates input, registers a pending task and returns at
 * once; the run itself executes on the dedicated run executor, writes progress
 * into the {@link PhoneTaskStore} after every step and stops cooperatively when
 * the task is cancelled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhoneTaskService {

    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z][\\w]*(\\.[A-Za-z][\\w]*)+");

    private final PhoneTaskStore taskStore;
    private final PhoneControlLoop controlLoop;
    private final DevicePort devicePort;
    private final PhoneAgentProperties properties;
    private final ExecutorService phoneTaskRunExecutor;

    /**
     * Registers a task and schedules its run.
     *
     * @return the task in {@link TaskStatus#PENDING}
     * @throws IllegalArgumentException
     *             for a blank goal or an out-of-range step budget
     * @throws IllegalStateException
     *             when the registry is full of unfinished tasks
     */
    public PhoneTask start(StartTaskCommand command) {
        if (command == null || command.getGoal() == null || command.getGoal().isBlank()) {
            throw new IllegalArgumentException("Goal is required");
        }
        int maxSteps = resolveMaxSteps(command.getMaxSteps());
        Map<String, Object> parameters = command.getParameters() != null ? command.getParameters() : Map.of();
        String goal = command.getGoal().trim();
        String app = command.getApp() != null && !command.getApp().isBlank() ? command.getApp().trim() : null;

        PhoneTask task = taskStore.create(goal, app, parameters, maxSteps);
        String taskId = task.getId();
        RunRequest request = RunRequest.builder()
                .taskId(taskId)
                .goal(goal)
                .app(app)
                .parameters(task.getParameters())
                .maxSteps(maxSteps)
                .build();

        try {
            Future<?> run = phoneTaskRunExecutor.submit(() -> execute(request));
            taskStore.registerRun(taskId, run);
            if (run.isDone()) {
                taskStore.unregisterRun(taskId);
            }
        } catch (RejectedExecutionException e) {
            log.error("[Tasks] Run executor rejected task {}", taskId);
            taskStore.update(taskId, TaskUpdate.builder()
                    .status(TaskStatus.FAILED)
                    .error("Run executor is not accepting tasks")
                    .build());
            throw new IllegalStateException("Run executor is not accepting tasks", e);
        }
        return task;
    }

    public Optional<PhoneTask> getStatus(String taskId) {
        return taskStore.get(taskId);
    }

    public List<PhoneTask> list(String status, Integer limit) {
        return taskStore.list(status, limit);
    }

    public Optional<CancelResult> cancel(String taskId) {
        return taskStore.requestCancel(taskId);
    }

    private int resolveMaxSteps(Integer requested) {
        PhoneAgentProperties.LoopProperties loop = properties.getLoop();
        if (requested == null) {
            return loop.getMaxSteps();
        }
        if (requested < 1 || requested > loop.getMaxStepsLimit()) {
            throw new IllegalArgumentException(
                    "maxSteps must be between 1 and " + loop.getMaxStepsLimit() + ", got " + requested);
        }
        return requested;
    }

    private void execute(RunRequest request) {
        String taskId = request.getTaskId();
        try {
            if (taskStore.isCancelRequested(taskId)) {
                log.info("[Tasks] Task {} cancelled before start", taskId);
                return;
            }
            taskStore.update(taskId, TaskUpdate.builder().status(TaskStatus.RUNNING).build());
            prepareDevice(request.getApp());

            RunResult result = controlLoop.run(request, new StoreRunMonitor(taskId, request.getMaxSteps()));
            taskStore.update(taskId, TaskUpdate.builder()
                    .status(statusFor(result))
                    .stepsTaken(result.getStepsTaken())
                    .inputTokens(result.getInputTokens())
                    .outputTokens(result.getOutputTokens())
                    .estimatedCost(result.getTotalCost())
                    .result(TaskResultSummary.from(result))
                    .error(result.getError())
                    .build());
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            log.error("[Tasks] Task {} crashed", taskId, e);
            taskStore.update(taskId, TaskUpdate.builder()
                    .status(TaskStatus.FAILED)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
        } finally {
            taskStore.unregisterRun(taskId);
        }
    }

    private static TaskStatus statusFor(RunResult result) {
        if (result.getOutcome() == RunOutcome.CANCELLED) {
            return TaskStatus.CANCELLED;
        }
        return result.isSuccess() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
    }

    private void prepareDevice(String app) {
        DeviceCommandResult wake = devicePort.wake();
        if (!wake.isSuccess()) {
            log.warn("[Tasks] Failed to wake device: {}", wake.getError());
        }
        if (app != null && PACKAGE_NAME.matcher(app).matches()) {
            DeviceCommandResult launch = devicePort.launchApp(app);
            if (!launch.isSuccess()) {
                log.warn("[Tasks] Failed to launch {}: {}", app, launch.getError());
            }
        }
    }

    private final class StoreRunMonitor implements RunMonitor {

        private final String taskId;
        private final int maxSteps;

        private StoreRunMonitor(String taskId, int maxSteps) {
            this.taskId = taskId;
            this.maxSteps = maxSteps;
        }

        @Override
        public boolean isCancelRequested() {
            return taskStore.isCancelRequested(taskId);
        }

        @Override
        public void onStep(StepRecord step, int inputTokens, int outputTokens, BigDecimal cost) {
            taskStore.update(taskId, TaskUpdate.builder()
                    .currentStep(describe(step))
                    .stepsTaken(step.getStepNumber())
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .estimatedCost(cost)
                    .build());
        }

        private String describe(StepRecord step) {
            String action = step.getDecision() != null && step.getDecision().getType() != null
                    ? step.getDecision().getType().getWireName()
                    : "error";
            return "Step " + step.getStepNumber() + "/" + maxSteps + ": " + action;
        }
    }
}
