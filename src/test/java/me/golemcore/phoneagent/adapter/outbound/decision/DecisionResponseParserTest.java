package me.golemcore.phoneagent.adapter.outbound.decision;

import me.golemcore.phoneagent.domain.model.ActionType;
import me.golemcore.phoneagent.domain.model.Decision;
import me.golemcore.phoneagent.domain.model.DecisionResult;
import me.golemcore.phoneagent.domain.model.DecisionServiceException;
import me.golemcore.phoneagent.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionResponseParserTest {

    private DecisionResponseParser parser;

    @BeforeEach
    void setUp() {
        parser = new DecisionResponseParser(AutoConfiguration.objectMapper());
    }

    @Test
    void shouldParseBareJsonDecision() {
        DecisionResult result = parser.parse(
                "{\"action\":\"tap\",\"params\":{\"x\":540,\"y\":1200},\"done\":false,\"reasoning\":\"Open menu\"}",
                120, 30);

        Decision decision = result.getDecision();
        assertEquals(ActionType.TAP, decision.getType());
        assertEquals(540, decision.param("x"));
        assertFalse(decision.isTerminal());
        assertEquals("Open menu", decision.getReasoning());
        assertEquals(120, result.getInputTokens());
        assertEquals(30, result.getOutputTokens());
    }

    @Test
    void shouldParseFencedJson() {
        String content = "Here you go:\n```json\n{\"action\": \"press_key\", \"params\": {\"key\": \"back\"}}\n```";

        Decision decision = parser.parse(content, 0, 0).getDecision();

        assertEquals(ActionType.PRESS_KEY, decision.getType());
        assertEquals("back", decision.stringParam("key"));
    }

    @Test
    void shouldExtractOutermostObjectFromProse() {
        assertEquals("{\"a\":{\"b\":1}}", DecisionResponseParser.extractJson("Sure! {\"a\":{\"b\":1}} hope that helps"));
    }

    @Test
    void shouldMarkDoneActionTerminalWithoutFlag() {
        Decision decision = parser.parse("{\"action\":\"done\",\"params\":{\"temperature\":72}}", 0, 0)
                .getDecision();

        assertTrue(decision.isTerminal());
        assertEquals(Map.of("temperature", 72), decision.getParams());
    }

    @Test
    void shouldHonourDoneFlagOnOtherActions() {
        Decision decision = parser.parse("{\"action\":\"tap\",\"params\":{\"x\":1,\"y\":2},\"done\":true}", 0, 0)
                .getDecision();

        assertEquals(ActionType.TAP, decision.getType());
        assertTrue(decision.isTerminal());
    }

    @Test
    void shouldDefaultMissingParamsToEmptyMap() {
        Decision decision = parser.parse("{\"action\":\"wait\"}", 0, 0).getDecision();

        assertTrue(decision.getParams().isEmpty());
        assertEquals("", decision.getReasoning());
    }

    @Test
    void shouldRejectEmptyContent() {
        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                () -> parser.parse("  ", 0, 0));

        assertEquals("Empty response from decision service", error.getMessage());
    }

    @Test
    void shouldRejectInvalidJson() {
        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                () -> parser.parse("{\"action\": tap}", 0, 0));

        assertTrue(error.getMessage().startsWith("Invalid JSON from decision service"));
    }

    @Test
    void shouldRejectNonObjectJson() {
        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                () -> parser.parse("[1, 2]", 0, 0));

        assertEquals("Decision must be a JSON object", error.getMessage());
    }

    @Test
    void shouldRejectMissingAction() {
        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                () -> parser.parse("{\"params\":{}}", 0, 0));

        assertEquals("Decision is missing the action field", error.getMessage());
    }

    @Test
    void shouldRejectUnknownAction() {
        DecisionServiceException error = assertThrows(DecisionServiceException.class,
                () -> parser.parse("{\"action\":\"fly\"}", 0, 0));

        assertEquals("Unknown action: fly", error.getMessage());
    }
}
