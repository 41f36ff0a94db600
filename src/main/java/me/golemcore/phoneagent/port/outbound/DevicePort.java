package me.golemcore.phoneagent.port.outbound;

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

import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.domain.model.ScreenState;

/**
 * Port for the controlled phone. Action methods report failures in the
 * returned {@link DeviceCommandResult} rather than by throwing.
 */
public interface DevicePort {

    /**
     * Captures screenshot and accessibility dump.
     *
     * @throws me.golemcore.phoneagent.domain.model.ScreenCaptureException
     *             when the state could not be read
     */
    ScreenState captureState();

    DeviceCommandResult tap(int x, int y);

    DeviceCommandResult typeText(String text);

    /**
     * Swipes from the screen center in the given direction (up, down, left,
     * right).
     */
    DeviceCommandResult swipe(String direction);

    DeviceCommandResult pressKey(String key);

    DeviceCommandResult launchApp(String packageName);

    /**
     * Turns the screen on and dismisses a swipe-only lock screen.
     */
    DeviceCommandResult wake();

    /**
     * Probes connectivity and reads basic device properties. Never throws.
     */
    DeviceInfo describe();
}
