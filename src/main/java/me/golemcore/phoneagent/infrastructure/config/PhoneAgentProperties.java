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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Centralized configuration for the phone agent, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code phone.*} prefix:
 * <ul>
 * <li>{@link DecisionProperties} - model selection and backend endpoints</li>
 * <li>{@link LoopProperties} - step budget, pacing and context limits</li>
 * <li>{@link PricingProperties} - token prices for cost estimates</li>
 * <li>{@link TasksProperties} - task registry capacity and run executor</li>
 * <li>{@link DeviceProperties} - ADB connection and screen geometry</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "phone")
@Data
public class PhoneAgentProperties {

    private DecisionProperties decision = new DecisionProperties();
    private LoopProperties loop = new LoopProperties();
    private PricingProperties pricing = new PricingProperties();
    private TasksProperties tasks = new TasksProperties();
    private DeviceProperties device = new DeviceProperties();
    private AuditProperties audit = new AuditProperties();
    private PromptsProperties prompts = new PromptsProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== DECISION ====================

    @Data
    public static class DecisionProperties {
        /**
         * Model identifier. {@code claude*} or {@code anthropic/*} selects the
         * Anthropic backend, anything else the OpenAI-compatible one.
         */
        private String model = "gpt-4o";
        private double temperature = 0.3;
        private int maxOutputTokens = 1000;
        private long timeoutMs = 60000;
        /**
         * Threads for blocking decision calls; raised to
         * {@code phone.tasks.run-threads} when lower.
         */
        private int executorThreads = 8;
        private String imageDetail = "low";
        private ProviderProperties openai = new ProviderProperties("https://api.openai.com/v1");
        private ProviderProperties anthropic = new ProviderProperties(null);
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;

        public ProviderProperties() {
        }

        public ProviderProperties(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxSteps = 20;
        private int maxStepsLimit = 100;
        private long stepDelayMs = 500;
        private int maxWaitSeconds = 30;
        private int maxHierarchyChars = 4000;
        private int maxLabeledElements = 25;
        private int maxUnlabeledElements = 10;
        private boolean includePreviousError = true;
    }

    @Data
    public static class PricingProperties {
        private BigDecimal inputPer1k = new BigDecimal("0.005");
        private BigDecimal outputPer1k = new BigDecimal("0.015");
        private int scale = 6;
    }

    // ==================== TASKS ====================

    @Data
    public static class TasksProperties {
        private int maxTasks = 100;
        private int evictionHeadroom = 0;
        private int defaultListLimit = 20;
        private int runThreads = 4;
        private boolean interruptOnCancel = true;
    }

    // ==================== DEVICE ====================

    @Data
    public static class DeviceProperties {
        private String adbPath = "adb";
        private String host;
        private int port = 5555;
        private long commandTimeoutMs = 30000;
        private int screenCenterX = 540;
        private int screenCenterY = 1200;
        private int swipeDistance = 500;
        private int swipeDurationMs = 300;
        private long healthCacheTtlMs = 30000;
    }

    @Data
    public static class AuditProperties {
        private boolean enabled = true;
        /**
         * Read by logback-spring.xml for the JSON-lines file location.
         */
        private String directory = "logs/audit";
    }

    @Data
    public static class PromptsProperties {
        private String location = "classpath:prompts/phone/";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
