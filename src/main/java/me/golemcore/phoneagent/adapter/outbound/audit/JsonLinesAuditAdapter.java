package me.golemcore.phoneagent.adapter.outbound.audit;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.AuditEvent;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.AuditPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Writes audit events as one JSON object per line to the {@code phone.audit}
 * logger. File placement, daily rotation and retention are configured in
 * {@code logback-spring.xml}.
 *
 * <p>
 * Screenshots and hierarchy dumps are replaced by their size; credential-like
 * values are redacted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonLinesAuditAdapter implements AuditPort {

    static final String AUDIT_LOGGER = "phone.audit";
    static final String REDACTED = "<redacted>";

    private static final Set<String> BULKY_KEYS = Set.of("screenshot", "screenshot_base64", "xml",
            "hierarchy_xml");
    private static final Set<String> SECRET_KEYS = Set.of("api_key", "apikey", "password", "secret",
            "authorization");

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ObjectMapper objectMapper;
    private final PhoneAgentProperties properties;

    @Override
    public void record(AuditEvent event) {
        if (!properties.getAudit().isEnabled() || event == null) {
            return;
        }
        try {
            AUDIT_LOG.info(objectMapper.writeValueAsString(toEntry(event)));
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - audit never fails the caller
            log.debug("[Audit] Failed to write {} event: {}", event.getEvent(), e.getMessage());
        }
    }

    Map<String, Object> toEntry(AuditEvent event) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", event.getTimestamp() != null ? event.getTimestamp().toString() : null);
        entry.put("event", event.getEvent());
        entry.put("task_id", event.getTaskId());
        if (event.getStepNumber() != null) {
            entry.put("step", event.getStepNumber());
        }
        if (event.getData() != null) {
            event.getData().forEach((key, value) -> entry.put(key, sanitize(key, value)));
        }
        return entry;
    }

    static Object sanitize(String key, Object value) {
        String normalized = key != null ? key.toLowerCase(Locale.ROOT) : "";
        if (value == null) {
            return null;
        }
        if (SECRET_KEYS.contains(normalized)) {
            return REDACTED;
        }
        if (BULKY_KEYS.contains(normalized) && value instanceof CharSequence text) {
            return "<" + text.length() + " chars>";
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), sanitize(String.valueOf(k), v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(sanitize(key, item));
            }
            return copy;
        }
        return value;
    }
}
