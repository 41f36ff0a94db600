package me.golemcore.phoneagent.domain.loop;

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
import me.golemcore.phoneagent.domain.model.ActionOutcome;
import me.golemcore.phoneagent.domain.model.ActionType;
import me.golemcore.phoneagent.domain.model.AuditEvent;
import me.golemcore.phoneagent.domain.model.Decision;
import me.golemcore.phoneagent.domain.model.DecisionRequest;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.domain.model.RunOutcome;
import me.golemcore.phoneagent.domain.model.RunRequest;
import me.golemcore.phoneagent.domain.model.RunResult;
import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.domain.model.StepRecord;
import me.golemcore.phoneagent.domain.service.ActionExecutor;
import me.golemcore.phoneagent.domain.service.CostCalculator;
import me.golemcore.phoneagent.domain.service.PromptTemplateService;
import me.golemcore.phoneagent.domain.service.ScreenContextRenderer;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.AuditPort;
import me.golemcore.phoneagent.port.outbound.DecisionPort;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Perceive-decide-act loop for one goal.
 *
 * <p>
 * Each iteration captures the screen, asks the {@link DecisionPort} for the
 * next action, applies it through the {@link ActionExecutor}, records a
 * {@link StepRecord} and audits it. The run ends when:
 * <ul>
 * <li>the decision is terminal ({@link RunOutcome#SUCCEEDED})</li>
 * <li>the model reports an error ({@link RunOutcome#ABORTED})</li>
 * <li>the step budget is used up ({@link RunOutcome#EXHAUSTED})</li>
 * <li>cancellation is requested or the thread is interrupted
 * ({@link RunOutcome#CANCELLED})</li>
 * <li>capture or decision fails ({@link RunOutcome#FAILED})</li>
 * </ul>
 *
 * <p>
 * A failed action never ends the run; its error is fed into the next step
 * context instead. Run totals are always the sum of the recorded steps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PhoneControlLoop {

    private final DevicePort devicePort;
    private final DecisionPort decisionPort;
    private final AuditPort auditPort;
    private final ActionExecutor actionExecutor;
    private final ScreenContextRenderer contextRenderer;
    private final PromptTemplateService promptTemplateService;
    private final CostCalculator costCalculator;
    private final PhoneAgentProperties properties;
    private final Clock clock;

    public RunResult run(RunRequest request, RunMonitor monitor) {
        PhoneAgentProperties.LoopProperties loop = properties.getLoop();
        int maxSteps = request.getMaxSteps() > 0 ? request.getMaxSteps() : loop.getMaxSteps();
        Map<String, Object> parameters = request.getParameters() != null ? request.getParameters() : Map.of();
        String systemPrompt = promptTemplateService.buildSystemPrompt(request.getGoal(), parameters);

        RunState state = new RunState(request.getTaskId());
        log.info("[PhoneLoop] Run {} started: goal='{}', maxSteps={}", request.getTaskId(), request.getGoal(),
                maxSteps);

        for (int stepNumber = 1; stepNumber <= maxSteps; stepNumber++) {
            if (isCancelled(monitor)) {
                return cancelled(state);
            }
            long startedAt = System.nanoTime();
            try {
                ScreenState screen = devicePort.captureState();
                String stepContext = contextRenderer.render(new ScreenContextRenderer.StepContext(
                        request.getGoal(), request.getApp(), parameters, stepNumber, maxSteps,
                        loop.isIncludePreviousError() ? state.previousError : null), screen);

                DecisionResult decisionResult = decide(DecisionRequest.builder()
                        .systemPrompt(systemPrompt)
                        .stepContext(stepContext)
                        .screenshotBase64(screen.getScreenshotBase64())
                        .build());
                state.pendingInputTokens = decisionResult.getInputTokens();
                state.pendingOutputTokens = decisionResult.getOutputTokens();
                Decision decision = decisionResult.getDecision();
                log.debug("[PhoneLoop] Step {}/{}: {} {} ({})", stepNumber, maxSteps,
                        decision.getType().getWireName(), decision.getParams(), decision.getReasoning());

                ActionOutcome outcome;
                if (decision.getType() == ActionType.DONE) {
                    outcome = ActionOutcome.ok();
                } else {
                    if (isCancelled(monitor)) {
                        return cancelled(state);
                    }
                    outcome = actionExecutor.apply(decision);
                }

                StepRecord step = state.record(stepNumber, decision, outcome.success(), outcome.error(),
                        elapsedMs(startedAt));
                report(monitor, step, state);
                audit(AuditEvent.STEP, state, stepNumber, stepData(step, screen));

                if (decision.getType() == ActionType.ERROR) {
                    log.warn("[PhoneLoop] Run {} aborted by decision service at step {}: {}",
                            state.taskId, stepNumber, outcome.error());
                    audit(AuditEvent.ACTION_FAILED, state, stepNumber, Map.of("error", outcome.error()));
                    return finish(state, RunOutcome.ABORTED, decision.getType().getWireName(), outcome.error(),
                            null);
                }
                if (!outcome.success()) {
                    log.info("[PhoneLoop] Step {} action {} failed: {}", stepNumber,
                            decision.getType().getWireName(), outcome.error());
                    audit(AuditEvent.ACTION_FAILED, state, stepNumber, Map.of(
                            "action", decision.getType().getWireName(),
                            "error", outcome.error(),
                            "failure_kind", outcome.failureKind().name().toLowerCase(Locale.ROOT)));
                }
                state.previousError = outcome.success() ? null : outcome.error();

                if (decision.isTerminal() || decision.getType() == ActionType.DONE) {
                    Map<String, Object> extracted = decision.getType() == ActionType.DONE
                            && decision.getParams() != null && !decision.getParams().isEmpty()
                                    ? Collections.unmodifiableMap(new LinkedHashMap<>(decision.getParams()))
                                    : null;
                    return finish(state, RunOutcome.SUCCEEDED, decision.getType().getWireName(), null, extracted);
                }

                if (stepNumber < maxSteps && loop.getStepDelayMs() > 0) {
                    Thread.sleep(loop.getStepDelayMs());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(state);
            } catch (RuntimeException e) { // NOSONAR - any failure ends the run with partial accounting
                if (Thread.currentThread().isInterrupted()) {
                    return cancelled(state);
                }
                return failed(state, stepNumber, e, elapsedMs(startedAt));
            }
        }

        String error = "Task did not complete within " + maxSteps + " steps";
        log.info("[PhoneLoop] Run {} exhausted its budget of {} steps", state.taskId, maxSteps);
        audit(AuditEvent.MAX_STEPS, state, null, Map.of("max_steps", maxSteps));
        return finish(state, RunOutcome.EXHAUSTED, RunResult.FINAL_ACTION_MAX_STEPS, error, null);
    }

    private DecisionResult decide(DecisionRequest request) throws InterruptedException {
        long timeoutMs = properties.getDecision().getTimeoutMs();
        CompletableFuture<DecisionResult> future = decisionPort.decide(request);
        try {
            DecisionResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null || result.getDecision() == null || result.getDecision().getType() == null) {
                throw new DecisionServiceException("Decision service returned no decision");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DecisionServiceException("Decision service timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DecisionServiceException decisionFailure) {
                throw decisionFailure;
            }
            throw new DecisionServiceException("Decision service failed: " + cause.getMessage(), cause);
        }
    }

    private boolean isCancelled(RunMonitor monitor) {
        return Thread.currentThread().isInterrupted() || monitor.isCancelRequested();
    }

    private RunResult cancelled(RunState state) {
        log.info("[PhoneLoop] Run {} cancelled after {} step(s)", state.taskId, state.steps.size());
        audit(AuditEvent.CANCELLED, state, null, Map.of());
        return finish(state, RunOutcome.CANCELLED, RunResult.FINAL_ACTION_CANCELLED, "Cancelled", null);
    }

    private RunResult failed(RunState state, int stepNumber, RuntimeException e, long elapsedMs) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("[PhoneLoop] Run {} failed at step {}: {}", state.taskId, stepNumber, message);
        Decision synthetic = Decision.builder()
                .type(ActionType.ERROR)
                .params(Map.of("message", message))
                .terminal(true)
                .reasoning("")
                .build();
        state.record(stepNumber, synthetic, false, message, elapsedMs);
        audit(AuditEvent.EXCEPTION, state, stepNumber, Map.of(
                "error", message,
                "exception", e.getClass().getSimpleName()));
        return finish(state, RunOutcome.FAILED, ActionType.ERROR.getWireName(), message, null);
    }

    private RunResult finish(RunState state, RunOutcome outcome, String finalAction, String error,
            Map<String, Object> extractedData) {
        RunResult result = RunResult.builder()
                .success(outcome == RunOutcome.SUCCEEDED)
                .outcome(outcome)
                .finalAction(finalAction)
                .stepsTaken(state.steps.size())
                .inputTokens(state.inputTokens())
                .outputTokens(state.outputTokens())
                .totalCost(state.cost())
                .steps(List.copyOf(state.steps))
                .error(error)
                .extractedData(extractedData)
                .build();
        if (outcome == RunOutcome.SUCCEEDED) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("steps", result.getStepsTaken());
            data.put("tokens", result.getTotalTokens());
            data.put("cost", result.getTotalCost());
            data.put("final_action", finalAction);
            audit(AuditEvent.COMPLETE, state, null, data);
        }
        log.info("[PhoneLoop] Run {} finished: outcome={}, steps={}, tokens={}, cost=${}", state.taskId,
                outcome, result.getStepsTaken(), result.getTotalTokens(), result.getTotalCost());
        return result;
    }

    private Map<String, Object> stepData(StepRecord step, ScreenState screen) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", step.getDecision().getType().getWireName());
        data.put("params", step.getDecision().getParams());
        data.put("reasoning", step.getDecision().getReasoning());
        data.put("done", step.getDecision().isTerminal());
        data.put("success", step.isSuccess());
        if (step.getError() != null) {
            data.put("error", step.getError());
        }
        data.put("input_tokens", step.getInputTokens());
        data.put("output_tokens", step.getOutputTokens());
        data.put("elapsed_ms", step.getElapsedMs());
        data.put("element_count", screen.getElementCount());
        data.put("screenshot", screen.getScreenshotBase64());
        return data;
    }

    private void report(RunMonitor monitor, StepRecord step, RunState state) {
        try {
            monitor.onStep(step, state.inputTokens(), state.outputTokens(), state.cost());
        } catch (RuntimeException e) { // NOSONAR - progress reporting must not end the run
            log.warn("[PhoneLoop] Progress report failed for step {}: {}", step.getStepNumber(), e.getMessage());
        }
    }

    private void audit(String event, RunState state, Integer stepNumber, Map<String, Object> data) {
        try {
            auditPort.record(AuditEvent.builder()
                    .event(event)
                    .taskId(state.taskId)
                    .stepNumber(stepNumber)
                    .timestamp(clock.instant())
                    .data(data)
                    .build());
        } catch (RuntimeException e) { // NOSONAR - audit is best-effort
            log.debug("[PhoneLoop] Audit sink failed for {}: {}", event, e.getMessage());
        }
    }

    private static long elapsedMs(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }

    private final class RunState {

        private final String taskId;
        private final List<StepRecord> steps = new ArrayList<>();
        private String previousError;
        private int pendingInputTokens;
        private int pendingOutputTokens;

        private RunState(String taskId) {
            this.taskId = taskId;
        }

        // Tokens spent in the current iteration are attached to whichever record closes it.
        StepRecord record(int stepNumber, Decision decision, boolean success, String error, long elapsedMs) {
            StepRecord step = StepRecord.builder()
                    .stepNumber(stepNumber)
                    .decision(decision)
                    .success(success)
                    .error(error)
                    .inputTokens(pendingInputTokens)
                    .outputTokens(pendingOutputTokens)
                    .elapsedMs(elapsedMs)
                    .build();
            pendingInputTokens = 0;
            pendingOutputTokens = 0;
            steps.add(step);
            return step;
        }

        int inputTokens() {
            return steps.stream().mapToInt(StepRecord::getInputTokens).sum();
        }

        int outputTokens() {
            return steps.stream().mapToInt(StepRecord::getOutputTokens).sum();
        }

        BigDecimal cost() {
            return costCalculator.estimate(inputTokens(), outputTokens());
        }
    }
}
