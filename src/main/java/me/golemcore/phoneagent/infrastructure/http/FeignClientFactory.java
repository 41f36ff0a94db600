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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Builds declarative Feign clients on the shared OkHttp transport with Jackson
 * JSON encoding.
 *
 * <pre>{@code
 * OpenAiChatApi api = factory.create(OpenAiChatApi.class, "https://api.openai.com/v1", 60000);
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a client whose calls give up after {@code readTimeoutMs}. Failed
     * calls are never retried.
     */
    public <T> T create(Class<T> apiType, String baseUrl, long readTimeoutMs) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .options(new Request.Options(
                        okHttpClient.connectTimeoutMillis(), TimeUnit.MILLISECONDS,
                        readTimeoutMs, TimeUnit.MILLISECONDS,
                        true))
                .target(apiType, baseUrl);
    }
}
