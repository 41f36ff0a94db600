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
import me.golemcore.phoneagent.domain.model.CancelResult;
import me.golemcore.phoneagent.domain.model.PhoneTask;
import me.golemcore.phoneagent.domain.model.TaskStatus;
import me.golemcore.phoneagent.domain.model.TaskUpdate;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;

/**
 * Bounded in-memory registry of phone tasks.
 *
 * <p>
 * Every operation runs under one lock and returns copies, so callers never see
 * a half-applied update. Status only moves forward. Completed and failed tasks
 * are frozen; a cancelled task keeps its status and error but still takes the
 * step counters, token totals, cost and result of the run winding down
 * underneath it. When the registry is full, the oldest terminal tasks are
 * evicted to make room; pending and running tasks are never evicted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhoneTaskStore {

    public static final String FILTER_ACTIVE = "active";
    public static final String CANCELLED_BY_USER = "Cancelled by user";

    private static final int ID_LENGTH = 8;

    private final PhoneAgentProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, PhoneTask> tasks = new LinkedHashMap<>();
    private final Map<String, Future<?>> runs = new HashMap<>();

    public PhoneTask create(String goal, String app, Map<String, Object> parameters, int maxSteps) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal is required");
        }
        synchronized (lock) {
            sweepForCapacity();
            Instant now = clock.instant();
            PhoneTask task = PhoneTask.builder()
                    .id(newId())
                    .goal(goal)
                    .app(app)
                    .parameters(parameters != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                            : Map.of())
                    .maxSteps(maxSteps)
                    .status(TaskStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            tasks.put(task.getId(), task);
            log.info("[Tasks] Created {} (maxSteps={}): {}", task.getId(), maxSteps, goal);
            return task.snapshot();
        }
    }

    public Optional<PhoneTask> get(String id) {
        synchronized (lock) {
            PhoneTask task = tasks.get(id);
            return task != null ? Optional.of(task.snapshot()) : Optional.empty();
        }
    }

    /**
     * Lists tasks newest first.
     *
     * @param statusFilter
     *            null for all, {@code active} for pending and running, or a
     *            status name
     * @param limit
     *            null for the configured default; clamped to the registry size
     */
    public List<PhoneTask> list(String statusFilter, Integer limit) {
        PhoneAgentProperties.TasksProperties config = properties.getTasks();
        int effectiveLimit = limit != null ? limit : config.getDefaultListLimit();
        effectiveLimit = Math.max(1, Math.min(effectiveLimit, config.getMaxTasks()));

        String filter = statusFilter != null && !statusFilter.isBlank()
                ? statusFilter.trim().toLowerCase(Locale.ROOT)
                : null;
        TaskStatus exact = filter != null && !FILTER_ACTIVE.equals(filter)
                ? TaskStatus.fromWireName(filter)
                : null;

        synchronized (lock) {
            List<PhoneTask> newestFirst = new ArrayList<>(tasks.values());
            Collections.reverse(newestFirst);
            return newestFirst.stream()
                    .filter(task -> filter == null
                            || (exact == null ? task.getStatus().isActive() : task.getStatus() == exact))
                    .sorted(Comparator.comparing(PhoneTask::getCreatedAt).reversed())
                    .limit(effectiveLimit)
                    .map(PhoneTask::snapshot)
                    .toList();
        }
    }

    /**
     * Merges the non-null fields of {@code update} into the task.
     *
     * @return the snapshot after the update; empty when the id is unknown
     */
    public Optional<PhoneTask> update(String id, TaskUpdate update) {
        synchronized (lock) {
            PhoneTask task = tasks.get(id);
            if (task == null) {
                return Optional.empty();
            }
            if (task.getStatus() == TaskStatus.CANCELLED) {
                applyAccounting(task, update);
                task.setUpdatedAt(clock.instant());
                return Optional.of(task.snapshot());
            }
            if (task.getStatus().isTerminal()) {
                log.debug("[Tasks] Ignoring update for finished task {} ({})", id, task.getStatus().wireName());
                return Optional.of(task.snapshot());
            }
            apply(task, update);
            return Optional.of(task.snapshot());
        }
    }

    /**
     * Requests cancellation. A finished task is returned unchanged; otherwise
     * the task becomes {@link TaskStatus#CANCELLED} immediately and its run, if
     * registered, is signalled.
     */
    public Optional<CancelResult> requestCancel(String id) {
        Future<?> run;
        PhoneTask snapshot;
        synchronized (lock) {
            PhoneTask task = tasks.get(id);
            if (task == null) {
                return Optional.empty();
            }
            if (task.getStatus().isTerminal()) {
                return Optional.of(new CancelResult(task.snapshot(), true));
            }
            Instant now = clock.instant();
            task.setCancelRequested(true);
            task.setStatus(TaskStatus.CANCELLED);
            task.setError(CANCELLED_BY_USER);
            task.setCompletedAt(now);
            task.setUpdatedAt(now);
            run = runs.get(id);
            snapshot = task.snapshot();
        }

        if (run != null) {
            boolean signalled = run.cancel(properties.getTasks().isInterruptOnCancel());
            log.info("[Tasks] Cancel requested for {} (signalled={})", id, signalled);
        } else {
            log.info("[Tasks] Cancel requested for {} before its run started", id);
        }
        return Optional.of(new CancelResult(snapshot, false));
    }

    public boolean isCancelRequested(String id) {
        synchronized (lock) {
            PhoneTask task = tasks.get(id);
            return task != null && task.isCancelRequested();
        }
    }

    public void registerRun(String id, Future<?> run) {
        synchronized (lock) {
            if (tasks.containsKey(id)) {
                runs.put(id, run);
            }
        }
    }

    public void unregisterRun(String id) {
        synchronized (lock) {
            runs.remove(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    private void apply(PhoneTask task, TaskUpdate update) {
        Instant now = clock.instant();
        TaskStatus next = update.getStatus();
        if (next != null && next != task.getStatus()) {
            if (task.getStatus().canTransitionTo(next)) {
                task.setStatus(next);
                if (next == TaskStatus.RUNNING && task.getStartedAt() == null) {
                    task.setStartedAt(now);
                }
                if (next.isTerminal() && task.getCompletedAt() == null) {
                    task.setCompletedAt(now);
                }
            } else {
                log.warn("[Tasks] Refusing to move {} from {} to {}", task.getId(),
                        task.getStatus().wireName(), next.wireName());
            }
        }
        applyAccounting(task, update);
        if (update.getError() != null) {
            task.setError(update.getError());
        }
        task.setUpdatedAt(now);
    }

    private void applyAccounting(PhoneTask task, TaskUpdate update) {
        if (update.getCurrentStep() != null) {
            task.setCurrentStep(update.getCurrentStep());
        }
        if (update.getStepsTaken() != null) {
            task.setStepsTaken(Math.max(task.getStepsTaken(), update.getStepsTaken()));
        }
        if (update.getInputTokens() != null) {
            task.setInputTokens(monotonic(task.getId(), "inputTokens", task.getInputTokens(),
                    update.getInputTokens()));
        }
        if (update.getOutputTokens() != null) {
            task.setOutputTokens(monotonic(task.getId(), "outputTokens", task.getOutputTokens(),
                    update.getOutputTokens()));
        }
        if (update.getEstimatedCost() != null) {
            BigDecimal current = task.getEstimatedCost();
            if (current != null && update.getEstimatedCost().compareTo(current) < 0) {
                log.warn("[Tasks] Refusing to lower estimatedCost of {} from {} to {}", task.getId(), current,
                        update.getEstimatedCost());
            } else {
                task.setEstimatedCost(update.getEstimatedCost());
            }
        }
        if (update.getResult() != null) {
            task.setResult(update.getResult());
        }
    }

    private int monotonic(String id, String field, int current, int proposed) {
        if (proposed < current) {
            log.warn("[Tasks] Refusing to lower {} of {} from {} to {}", field, id, current, proposed);
            return current;
        }
        return proposed;
    }

    // Caller holds the lock.
    private void sweepForCapacity() {
        PhoneAgentProperties.TasksProperties config = properties.getTasks();
        int maxTasks = config.getMaxTasks();
        if (tasks.size() < maxTasks) {
            return;
        }
        int toRemove = tasks.size() - maxTasks + 1 + Math.max(0, config.getEvictionHeadroom());
        List<PhoneTask> evictable = tasks.values().stream()
                .filter(task -> task.getStatus().isTerminal())
                .sorted(Comparator.comparing(PhoneTaskStore::finishedAt))
                .limit(toRemove)
                .toList();
        for (PhoneTask task : evictable) {
            tasks.remove(task.getId());
            runs.remove(task.getId());
        }
        if (!evictable.isEmpty()) {
            log.info("[Tasks] Evicted {} finished task(s) to stay within {}", evictable.size(), maxTasks);
        }
        if (tasks.size() >= maxTasks) {
            throw new IllegalStateException("Task registry is full (" + maxTasks + " active tasks)");
        }
    }

    private static Instant finishedAt(PhoneTask task) {
        return task.getCompletedAt() != null ? task.getCompletedAt() : task.getCreatedAt();
    }

    // Caller holds the lock.
    private String newId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
        } while (tasks.containsKey(id));
        return id;
    }
}
