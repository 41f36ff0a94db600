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
import me.golemcore.phoneagent.domain.model.ActionOutcome;
import me.golemcore.phoneagent.domain.model.Decision;
import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

/**
 * Applies one {@link Decision} to the device with exactly one device call.
 *
 * <p>
 * Never throws. Parameter problems are reported as
 * {@link ActionOutcome.FailureKind#VALIDATION} without touching the device;
 * device errors and exceptions as {@link ActionOutcome.FailureKind#DEVICE}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExecutor {

    static final String DEFAULT_ERROR_MESSAGE = "Unknown error from decision service";
    private static final Set<String> DIRECTIONS = Set.of("up", "down", "left", "right");

    private final DevicePort devicePort;
    private final PhoneAgentProperties properties;

    public ActionOutcome apply(Decision decision) {
        try {
            return switch (decision.getType()) {
            case TAP -> tap(decision);
            case TYPE -> type(decision);
            case SWIPE -> swipe(decision);
            case PRESS_KEY -> pressKey(decision);
            case WAIT -> waitFor(decision);
            case DONE -> ActionOutcome.ok();
            case ERROR -> reportedError(decision);
            };
        } catch (RuntimeException e) { // NOSONAR - device adapters must not break the loop
            log.warn("[Action] {} failed with exception: {}", decision.getType().getWireName(), e.getMessage());
            return ActionOutcome.deviceFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ActionOutcome tap(Decision decision) {
        Integer x = toInt(decision.param("x"));
        Integer y = toInt(decision.param("y"));
        if (x == null || y == null) {
            return invalid("tap requires x and y parameters");
        }
        return fromDevice("tap", devicePort.tap(x, y));
    }

    private ActionOutcome type(Decision decision) {
        String text = decision.stringParam("text");
        if (text == null || text.isEmpty()) {
            return invalid("type requires text parameter");
        }
        return fromDevice("type", devicePort.typeText(text));
    }

    private ActionOutcome swipe(Decision decision) {
        String direction = decision.stringParam("direction");
        String normalized = direction == null || direction.isBlank()
                ? "up"
                : direction.trim().toLowerCase(Locale.ROOT);
        if (!DIRECTIONS.contains(normalized)) {
            return invalid("Invalid direction: " + direction + ". Use up/down/left/right.");
        }
        return fromDevice("swipe", devicePort.swipe(normalized));
    }

    private ActionOutcome pressKey(Decision decision) {
        String key = decision.stringParam("key");
        if (key == null || key.isBlank()) {
            return invalid("press_key requires key parameter");
        }
        return fromDevice("press_key", devicePort.pressKey(key.trim()));
    }

    private ActionOutcome waitFor(Decision decision) {
        Object raw = decision.param("seconds");
        double seconds;
        if (raw == null) {
            seconds = 1;
        } else {
            try {
                seconds = Double.parseDouble(raw.toString());
            } catch (NumberFormatException e) {
                return invalid("wait requires numeric seconds, got: " + raw);
            }
        }
        double clamped = Math.max(0, Math.min(seconds, properties.getLoop().getMaxWaitSeconds()));
        try {
            Thread.sleep((long) (clamped * 1000));
            return ActionOutcome.ok();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionOutcome.deviceFailure("Wait interrupted");
        }
    }

    private ActionOutcome reportedError(Decision decision) {
        String message = decision.stringParam("message");
        return ActionOutcome.reported(message != null && !message.isBlank() ? message : DEFAULT_ERROR_MESSAGE);
    }

    private ActionOutcome invalid(String error) {
        log.info("[Action] Rejected: {}", error);
        return ActionOutcome.invalid(error);
    }

    private ActionOutcome fromDevice(String action, DeviceCommandResult result) {
        if (result != null && result.isSuccess()) {
            return ActionOutcome.ok();
        }
        String error = result != null && result.getError() != null && !result.getError().isBlank()
                ? result.getError()
                : action + " failed";
        log.warn("[Action] Device rejected {}: {}", action, error);
        return ActionOutcome.deviceFailure(error);
    }

    private static Integer toInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return (int) Math.round(Double.parseDouble(value.toString().trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
