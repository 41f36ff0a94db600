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

/**
 * Decision backend was unreachable, returned nothing usable, or returned
 * content that could not be parsed into a {@link Decision}.
 */
public class DecisionServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DecisionServiceException(String message) {
        super(message);
    }

    public DecisionServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
