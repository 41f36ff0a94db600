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
import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Device health probe with a short-lived cache, so frequent polling does not
 * hammer the device.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceHealthService {

    private final DevicePort devicePort;
    private final PhoneAgentProperties properties;
    private final Clock clock;

    private DeviceInfo cached;

    public synchronized DeviceInfo check() {
        Instant now = clock.instant();
        Duration ttl = Duration.ofMillis(properties.getDevice().getHealthCacheTtlMs());
        if (cached != null && cached.getCheckedAt() != null
                && now.isBefore(cached.getCheckedAt().plus(ttl))) {
            return cached;
        }
        DeviceInfo info = devicePort.describe();
        cached = info.toBuilder().checkedAt(now).build();
        log.debug("[Health] Device {} connected={}", cached.getSerial(), cached.isConnected());
        return cached;
    }

    public synchronized void invalidate() {
        cached = null;
    }
}
