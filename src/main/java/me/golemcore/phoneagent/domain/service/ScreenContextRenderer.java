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
import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.domain.model.UiElement;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the per-step user message sent to the decision service: task
 * context, a compact element summary and the (truncated) accessibility dump.
 *
 * <p>
 * Output is a pure function of its inputs and the configured limits.
 */
@Service
@RequiredArgsConstructor
public class ScreenContextRenderer {

    static final String TRUNCATION_MARKER = "\n... [truncated]";

    private final PhoneAgentProperties properties;

    /**
     * Per-step inputs that are not part of the screen itself.
     */
    public record StepContext(String goal, String app, Map<String, Object> parameters,
            int stepNumber, int maxSteps, String previousError) {
    }

    public String render(StepContext context, ScreenState screen) {
        PhoneAgentProperties.LoopProperties loop = properties.getLoop();
        List<String> parts = new ArrayList<>();

        parts.add("## Task Context");
        parts.add("Task: " + context.goal());
        parts.add("Step: " + context.stepNumber() + " of " + context.maxSteps());
        if (context.app() != null && !context.app().isBlank()) {
            parts.add("Target app: " + context.app());
        }

        if (context.parameters() != null && !context.parameters().isEmpty()) {
            parts.add("\n### Parameters");
            context.parameters().forEach((key, value) -> parts.add("- " + key + ": " + value));
        }

        if (context.previousError() != null && !context.previousError().isBlank()) {
            parts.add("\n### Previous Action");
            parts.add("Previous action failed: " + context.previousError());
        }

        parts.add("\n## Screen State");
        parts.add("Total elements on screen: " + screen.getElementCount());
        if (screen.getDominantPackage() != null && !screen.getDominantPackage().isBlank()) {
            parts.add("Dominant package on screen: " + screen.getDominantPackage());
        }

        appendElements(parts, screen.getElements(), loop);
        appendHierarchy(parts, screen.getHierarchyXml(), loop.getMaxHierarchyChars());

        parts.add("\n## Your Response");
        parts.add("Respond with a JSON object containing:");
        parts.add("- action: tap|type|swipe|press_key|wait|done|error");
        parts.add("- params: {x, y} for tap, {text} for type, {direction} for swipe, {key} for press_key, "
                + "{seconds} for wait, extracted data for done, {message} for error");
        parts.add("- done: true if the task is complete");
        parts.add("- reasoning: your thought process");

        return String.join("\n", parts);
    }

    private void appendElements(List<String> parts, List<UiElement> elements,
            PhoneAgentProperties.LoopProperties loop) {
        if (elements == null || elements.isEmpty()) {
            return;
        }
        List<UiElement> labeled = new ArrayList<>();
        List<UiElement> unlabeledClickable = new ArrayList<>();
        for (UiElement element : elements) {
            if (!element.getLabel().isEmpty()) {
                labeled.add(element);
            } else if (element.isClickable()) {
                unlabeledClickable.add(element);
            }
        }

        parts.add("\n### Interactive Elements (" + elements.size() + " total)");
        if (!labeled.isEmpty()) {
            int limit = Math.min(labeled.size(), loop.getMaxLabeledElements());
            parts.add("Labeled elements (up to " + loop.getMaxLabeledElements() + "):");
            for (int i = 0; i < limit; i++) {
                UiElement element = labeled.get(i);
                StringBuilder line = new StringBuilder()
                        .append(" [").append(i).append("] \"").append(element.getLabel()).append('"')
                        .append(" at (").append(element.getCenterX()).append(", ").append(element.getCenterY())
                        .append(") - ").append(element.isClickable() ? "clickable" : "text-only");
                String resourceId = shortResourceId(element.getResourceId());
                if (!resourceId.isEmpty()) {
                    line.append(" (id=").append(resourceId).append(')');
                }
                parts.add(line.toString());
            }
        }

        if (!unlabeledClickable.isEmpty()) {
            int limit = Math.min(unlabeledClickable.size(), loop.getMaxUnlabeledElements());
            parts.add("\nUnlabeled clickable elements (up to " + loop.getMaxUnlabeledElements() + "):");
            for (int i = 0; i < limit; i++) {
                UiElement element = unlabeledClickable.get(i);
                String resourceId = shortResourceId(element.getResourceId());
                String className = shortClassName(element.getClassName());
                StringBuilder line = new StringBuilder()
                        .append("  [u").append(i).append("] id=").append(resourceId.isEmpty() ? "unknown" : resourceId)
                        .append(" class=").append(className.isEmpty() ? "unknown" : className)
                        .append(" at (").append(element.getCenterX()).append(", ").append(element.getCenterY())
                        .append(')');
                if (element.hasBounds()) {
                    line.append(" bounds=(").append(element.getLeft()).append(',').append(element.getTop())
                            .append(")-(").append(element.getRight()).append(',').append(element.getBottom())
                            .append(')');
                }
                parts.add(line.toString());
            }
        }
    }

    private void appendHierarchy(List<String> parts, String xml, int maxChars) {
        if (xml == null || xml.isEmpty()) {
            return;
        }
        if (xml.length() > maxChars) {
            parts.add("\n### XML (truncated)");
            parts.add(xml.substring(0, maxChars) + TRUNCATION_MARKER);
        } else {
            parts.add("\n### XML");
            parts.add(xml);
        }
    }

    private static String shortResourceId(String resourceId) {
        if (resourceId == null) {
            return "";
        }
        String trimmed = resourceId.trim();
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static String shortClassName(String className) {
        if (className == null) {
            return "";
        }
        String trimmed = className.trim();
        int dot = trimmed.lastIndexOf('.');
        return dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
    }
}
