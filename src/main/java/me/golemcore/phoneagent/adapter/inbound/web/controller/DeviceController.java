package me.golemcore.phoneagent.adapter.inbound.web.controller;

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
import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.domain.service.DeviceHealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Device health, cached for a short TTL unless a refresh is requested.
 */
@RestController
@RequestMapping("/api/phone/device")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceHealthService deviceHealthService;

    @GetMapping("/health")
    public Mono<ResponseEntity<DeviceInfo>> health(@RequestParam(defaultValue = "false") boolean refresh) {
        return Mono.fromCallable(() -> {
            if (refresh) {
                deviceHealthService.invalidate();
            }
            return ResponseEntity.ok(deviceHealthService.check());
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
