package me.golemcore.phoneagent.infrastructure.config;

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

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dedicated executors for background phone runs and for the blocking decision
 * calls they make, both kept off the reactive request threads and the common
 * fork-join pool.
 */
@Configuration
public class TaskRunConfiguration {

    static final String THREAD_PREFIX = "phone-task-run-";
    static final String DECISION_THREAD_PREFIX = "phone-decision-";

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService phoneTaskRunExecutor(PhoneAgentProperties properties) {
        int threads = Math.max(1, properties.getTasks().getRunThreads());
        return Executors.newFixedThreadPool(threads, daemonThreadFactory(THREAD_PREFIX));
    }

    /**
     * Never smaller than the run pool, so every running task can have a
     * decision call in flight at once.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService phoneDecisionExecutor(PhoneAgentProperties properties) {
        int threads = Math.max(Math.max(1, properties.getTasks().getRunThreads()),
                properties.getDecision().getExecutorThreads());
        return Executors.newFixedThreadPool(threads, daemonThreadFactory(DECISION_THREAD_PREFIX));
    }

    static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
