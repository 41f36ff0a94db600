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

import lombok.Builder;
import lombok.Data;

/**
 * One node of the accessibility hierarchy with its screen bounds.
 */
@Data
@Builder
public class UiElement {

    private String text;
    private String contentDesc;
    private String resourceId;
    private String className;
    private String packageName;
    private int left;
    private int top;
    private int right;
    private int bottom;
    private boolean clickable;
    private boolean scrollable;
    private boolean focused;

    @Builder.Default
    private boolean enabled = true;

    public int getCenterX() {
        return (left + right) / 2;
    }

    public int getCenterY() {
        return (top + bottom) / 2;
    }

    /**
     * Visible label: text, falling back to the content description. Empty when
     * the element has neither.
     */
    public String getLabel() {
        if (text != null && !text.isBlank()) {
            return text.trim();
        }
        if (contentDesc != null && !contentDesc.isBlank()) {
            return contentDesc.trim();
        }
        return "";
    }

    public boolean hasBounds() {
        return right > left || bottom > top;
    }
}
