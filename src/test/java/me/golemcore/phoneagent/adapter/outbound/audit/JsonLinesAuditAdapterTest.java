package me.golemcore.phoneagent.adapter.outbound.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.phoneagent.domain.model.AuditEvent;
import me.golemcore.phoneagent.infrastructure.config.AutoConfiguration;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLinesAuditAdapterTest {

    private ObjectMapper objectMapper;
    private PhoneAgentProperties properties;
    private JsonLinesAuditAdapter adapter;
    private ListAppender<ILoggingEvent> appender;
    private Logger auditLogger;

    @BeforeEach
    void setUp() {
        objectMapper = AutoConfiguration.objectMapper();
        properties = new PhoneAgentProperties();
        adapter = new JsonLinesAuditAdapter(objectMapper, properties);

        auditLogger = (Logger) LoggerFactory.getLogger(JsonLinesAuditAdapter.AUDIT_LOGGER);
        appender = new ListAppender<>();
        appender.start();
        auditLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        auditLogger.detachAppender(appender);
    }

    @Test
    void shouldWriteOneJsonObjectPerEvent() throws Exception {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", "tap");
        data.put("screenshot", "aGVsbG8gd29ybGQ=");
        data.put("params", Map.of("x", 540, "y", 1200));

        adapter.record(AuditEvent.builder()
                .event(AuditEvent.STEP)
                .taskId("a1b2c3d4")
                .stepNumber(2)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .data(data)
                .build());

        assertEquals(1, appender.list.size());
        String line = appender.list.get(0).getFormattedMessage();
        assertFalse(line.contains("\n"));
        JsonNode json = objectMapper.readTree(line);
        assertEquals("2026-03-01T10:00:00Z", json.get("timestamp").asText());
        assertEquals("runner_step", json.get("event").asText());
        assertEquals("a1b2c3d4", json.get("task_id").asText());
        assertEquals(2, json.get("step").asInt());
        assertEquals("<16 chars>", json.get("screenshot").asText());
        assertEquals(540, json.get("params").get("x").asInt());
    }

    @Test
    void shouldSkipEventsWhenDisabled() {
        properties.getAudit().setEnabled(false);

        adapter.record(AuditEvent.builder().event(AuditEvent.COMPLETE).taskId("a1b2c3d4").build());

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void shouldOmitStepForRunLevelEvents() {
        Map<String, Object> entry = adapter.toEntry(AuditEvent.builder()
                .event(AuditEvent.MAX_STEPS)
                .taskId("a1b2c3d4")
                .data(Map.of("max_steps", 20))
                .build());

        assertFalse(entry.containsKey("step"));
        assertEquals(20, entry.get("max_steps"));
    }

    @Test
    void shouldRedactSecretsRecursively() {
        Object sanitized = JsonLinesAuditAdapter.sanitize("params", Map.of(
                "api_key", "sk-live",
                "nested", Map.of("Password", "hunter2"),
                "text", "hello"));

        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) sanitized;
        assertEquals(JsonLinesAuditAdapter.REDACTED, map.get("api_key"));
        assertEquals(JsonLinesAuditAdapter.REDACTED, ((Map<?, ?>) map.get("nested")).get("Password"));
        assertEquals("hello", map.get("text"));
    }

    @Test
    void shouldSummarizeBulkyValuesInsideLists() {
        Object sanitized = JsonLinesAuditAdapter.sanitize("hierarchy_xml", List.of("<hierarchy/>"));

        assertEquals(List.of("<12 chars>"), sanitized);
    }
}
