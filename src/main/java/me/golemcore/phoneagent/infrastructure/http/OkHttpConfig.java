package me.golemcore.phoneagent.infrastructure.http;

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
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the decision backends, configured from
 * {@code phone.http.*}.
 *
 * <p>
 * Read timeouts are capped by {@code phone.decision.timeout-ms}. Only failed
 * connection attempts are retried; decision requests themselves never are.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final PhoneAgentProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        PhoneAgentProperties.HttpProperties http = properties.getHttp();
        long decisionTimeoutMs = properties.getDecision().getTimeoutMs();

        // Whole-call ceiling: one decision request, including connect and upload
        // of the screenshot, never outlives the loop's own wait for it.
        long callTimeoutMs = decisionTimeoutMs + http.getConnectTimeout();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(Math.min(http.getReadTimeout(), decisionTimeoutMs), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .callTimeout(callTimeoutMs, TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }
}
