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
import lombok.Value;

import java.time.Instant;

/**
 * Device connectivity and identity as reported by a health probe.
 */
@Value
@Builder(toBuilder = true)
public class DeviceInfo {

    boolean connected;
    String serial;
    String model;
    String androidVersion;
    String buildId;
    Integer batteryLevel;
    String error;
    Instant checkedAt;

    public static DeviceInfo disconnected(String serial, String error) {
        return DeviceInfo.builder()
                .connected(false)
                .serial(serial)
                .error(error)
                .build();
    }
}
