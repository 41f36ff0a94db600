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
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Builds the system prompt for a run from the base phone-control prompt and an
 * optional named task template.
 *
 * <p>
 * A goal that matches a template name ({@code <name>.md} under
 * {@code phone.prompts.location}) is replaced by that template, with
 * {@code {key}}, {@code {{key}}} and {@code {{ key }}} placeholders filled from
 * the caller parameters. Any other goal is used verbatim as the task prompt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptTemplateService {

    static final String BASE_TEMPLATE = "_base";
    static final String TASK_HEADER = "\n\n# Current Task\n\n";
    static final String FALLBACK_BASE_PROMPT = """
            You are controlling an Android phone via accessibility commands.
            Analyze the screen state and decide the next action to complete the task.
            Respond with JSON: {"action": "tap|type|swipe|press_key|wait|done|error", \
            "params": {}, "done": boolean, "reasoning": "..."}
            """;

    private static final Pattern TEMPLATE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,63}");

    private final PhoneAgentProperties properties;
    private final ResourceLoader resourceLoader;

    private final Map<String, Optional<String>> cache = new ConcurrentHashMap<>();

    public String buildSystemPrompt(String goal, Map<String, Object> parameters) {
        String base = loadTemplate(BASE_TEMPLATE).orElseGet(() -> {
            log.warn("[Prompts] Base prompt not found, using minimal prompt");
            return FALLBACK_BASE_PROMPT;
        });
        String task = resolveTaskPrompt(goal, parameters);
        return base + TASK_HEADER + task;
    }

    String resolveTaskPrompt(String goal, Map<String, Object> parameters) {
        String name = goal != null ? goal.trim() : "";
        if (TEMPLATE_NAME.matcher(name).matches() && !BASE_TEMPLATE.equals(name)) {
            Optional<String> template = loadTemplate(name);
            if (template.isPresent()) {
                log.debug("[Prompts] Using task template: {}", name);
                return substitute(template.get(), parameters);
            }
        }
        return goal;
    }

    static String substitute(String template, Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return template;
        }
        String result = template;
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            String value = String.valueOf(entry.getValue());
            String key = entry.getKey();
            result = result.replace("{{ " + key + " }}", value)
                    .replace("{{" + key + "}}", value)
                    .replace("{" + key + "}", value);
        }
        return result;
    }

    private Optional<String> loadTemplate(String name) {
        return cache.computeIfAbsent(name, this::readTemplate);
    }

    private Optional<String> readTemplate(String name) {
        String location = properties.getPrompts().getLocation();
        String path = location.endsWith("/") ? location + name + ".md" : location + "/" + name + ".md";
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream is = resource.getInputStream()) {
            return Optional.of(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("[Prompts] Failed to read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
