package me.golemcore.phoneagent.adapter.outbound.device;

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

import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.domain.model.UiElement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain attribute read of a {@code uiautomator dump}. Each {@code <node>} is
 * turned into a {@link UiElement}; no layout heuristics are applied.
 */
@Component
public class UiHierarchyParser {

    private static final Pattern NODE = Pattern.compile("<node\\s+([^>]*?)/?>");
    private static final Pattern ATTRIBUTE = Pattern.compile("([\\w:-]+)=\"([^\"]*)\"");
    private static final Pattern BOUNDS = Pattern.compile("\\[(-?\\d+),(-?\\d+)\\]\\[(-?\\d+),(-?\\d+)\\]");

    public List<UiElement> parse(String xml) {
        List<UiElement> elements = new ArrayList<>();
        if (xml == null || xml.isEmpty()) {
            return elements;
        }
        Matcher node = NODE.matcher(xml);
        while (node.find()) {
            Map<String, String> attrs = attributes(node.group(1));
            UiElement.UiElementBuilder builder = UiElement.builder()
                    .text(attrs.getOrDefault("text", ""))
                    .contentDesc(attrs.getOrDefault("content-desc", ""))
                    .resourceId(attrs.getOrDefault("resource-id", ""))
                    .className(attrs.getOrDefault("class", ""))
                    .packageName(attrs.getOrDefault("package", ""))
                    .clickable(flag(attrs, "clickable", false))
                    .scrollable(flag(attrs, "scrollable", false))
                    .focused(flag(attrs, "focused", false))
                    .enabled(flag(attrs, "enabled", true));
            Matcher bounds = BOUNDS.matcher(attrs.getOrDefault("bounds", ""));
            if (bounds.find()) {
                builder.left(Integer.parseInt(bounds.group(1)))
                        .top(Integer.parseInt(bounds.group(2)))
                        .right(Integer.parseInt(bounds.group(3)))
                        .bottom(Integer.parseInt(bounds.group(4)));
            }
            elements.add(builder.build());
        }
        return elements;
    }

    /**
     * Builds a screen state from a dump, keeping only elements that are
     * clickable or carry a label.
     */
    public ScreenState toScreenState(String xml, String screenshotBase64) {
        List<UiElement> all = parse(xml);
        List<UiElement> interesting = all.stream()
                .filter(element -> element.isClickable() || !element.getLabel().isEmpty())
                .toList();
        return ScreenState.builder()
                .screenshotBase64(screenshotBase64)
                .hierarchyXml(xml)
                .elements(interesting)
                .elementCount(all.size())
                .dominantPackage(dominantPackage(all))
                .build();
    }

    static String dominantPackage(List<UiElement> elements) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (UiElement element : elements) {
            String pkg = element.getPackageName();
            if (pkg != null && !pkg.isBlank()) {
                counts.merge(pkg, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static Map<String, String> attributes(String raw) {
        Map<String, String> attrs = new HashMap<>();
        Matcher matcher = ATTRIBUTE.matcher(raw);
        while (matcher.find()) {
            attrs.put(matcher.group(1), unescape(matcher.group(2)));
        }
        return attrs;
    }

    private static boolean flag(Map<String, String> attrs, String name, boolean defaultValue) {
        String value = attrs.get(name);
        return value == null ? defaultValue : "true".equalsIgnoreCase(value);
    }

    private static String unescape(String value) {
        if (value.indexOf('&') < 0) {
            return value;
        }
        return value.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
