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
 * Result of applying one decision to the device.
 *
 * @param success
 *            whether the action had its intended effect
 * @param error
 *            failure description, null on success
 * @param failureKind
 *            what went wrong, null on success
 */
public record ActionOutcome(boolean success, String error, FailureKind failureKind) {

    public enum FailureKind {
        /**
         * Missing or malformed action parameters, no device call made.
         */
        VALIDATION,

        /**
         * The device call itself failed or timed out.
         */
        DEVICE,

        /**
         * The model reported an error condition.
         */
        REPORTED
    }

    public static ActionOutcome ok() {
        return new ActionOutcome(true, null, null);
    }

    public static ActionOutcome invalid(String error) {
        return new ActionOutcome(false, error, FailureKind.VALIDATION);
    }

    public static ActionOutcome deviceFailure(String error) {
        return new ActionOutcome(false, error, FailureKind.DEVICE);
    }

    public static ActionOutcome reported(String error) {
        return new ActionOutcome(false, error, FailureKind.REPORTED);
    }
}
