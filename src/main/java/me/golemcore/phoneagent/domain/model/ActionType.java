package me.golemcore.phoneagent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of primitive actions the decision service may choose from. Each
 * constant carries the wire name used in model responses and audit events.
 */
public enum ActionType {

    /**
     * Tap a point on the screen, params {@code x} and {@code y}.
     */
    TAP("tap"),

    /**
     * Enter text into the focused field, param {@code text}.
     */
    TYPE("type"),

    /**
     * Directional swipe gesture, param {@code direction}.
     */
    SWIPE("swipe"),

    /**
     * Named hardware or navigation key, param {@code key}.
     */
    PRESS_KEY("press_key"),

    /**
     * Pause for {@code seconds}.
     */
    WAIT("wait"),

    /**
     * Goal reached. Non-empty params carry extracted data.
     */
    DONE("done"),

    /**
     * The model gave up, param {@code message}.
     */
    ERROR("error");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire name, case-insensitively.
     *
     * @throws IllegalArgumentException
     *             when the name is not one of the known actions
     */
    @JsonCreator
    public static ActionType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Action name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action: " + name);
    }
}
