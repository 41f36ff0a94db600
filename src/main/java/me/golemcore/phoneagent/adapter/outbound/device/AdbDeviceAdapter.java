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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.domain.model.ScreenCaptureException;
import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link DevicePort} backed by the {@code adb} CLI over TCP/IP.
 *
 * <p>
 * Swipes start at the configured screen center; key names map to Android key
 * codes. Text input is escaped for the device shell, with spaces sent as
 * {@code %s}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdbDeviceAdapter implements DevicePort {

    static final String DUMP_PATH = "/sdcard/ui_dump.xml";

    static final Map<String, String> KEY_CODES = Map.of(
            "home", "KEYCODE_HOME",
            "back", "KEYCODE_BACK",
            "enter", "KEYCODE_ENTER",
            "recent", "KEYCODE_APP_SWITCH",
            "volume_up", "KEYCODE_VOLUME_UP",
            "volume_down", "KEYCODE_VOLUME_DOWN",
            "power", "KEYCODE_POWER",
            "tab", "KEYCODE_TAB",
            "delete", "KEYCODE_DEL",
            "search", "KEYCODE_SEARCH");

    private static final Pattern BATTERY_LEVEL = Pattern.compile("level:\\s*(\\d+)");
    private static final String SHELL_SPECIALS = "\\'\"&|;<>()$`";
    private static final int UNLOCK_SWIPE_MS = 200;

    private final AdbCommandRunner runner;
    private final UiHierarchyParser hierarchyParser;
    private final PhoneAgentProperties properties;

    private volatile boolean connected = false;

    @Override
    public ScreenState captureState() {
        ensureConnected();
        AdbCommandRunner.BinaryResult screenshot = runner.execOut("screencap", "-p");
        if (!screenshot.success() || screenshot.data().length == 0) {
            connected = false;
            throw new ScreenCaptureException("Screenshot failed: "
                    + (screenshot.error() != null ? screenshot.error() : "empty image"));
        }

        DeviceCommandResult dump = runner.shell("uiautomator", "dump", DUMP_PATH);
        if (!dump.isSuccess()) {
            throw new ScreenCaptureException("UI dump failed: " + dump.getError());
        }
        DeviceCommandResult xml = runner.shell("cat", DUMP_PATH);
        if (!xml.isSuccess() || xml.getOutput() == null || !xml.getOutput().contains("<hierarchy")) {
            throw new ScreenCaptureException("UI dump could not be read: "
                    + (xml.getError() != null ? xml.getError() : "no hierarchy in output"));
        }
        runner.shell("rm", "-f", DUMP_PATH);

        String base64 = Base64.getEncoder().encodeToString(screenshot.data());
        ScreenState state = hierarchyParser.toScreenState(xml.getOutput().trim(), base64);
        log.debug("[ADB] Captured screen: {} nodes, {} interesting, package {}", state.getElementCount(),
                state.getElements().size(), state.getDominantPackage());
        return state;
    }

    @Override
    public DeviceCommandResult tap(int x, int y) {
        ensureConnected();
        log.info("[ADB] Tap ({}, {})", x, y);
        return runner.shell("input", "tap", String.valueOf(x), String.valueOf(y));
    }

    @Override
    public DeviceCommandResult typeText(String text) {
        ensureConnected();
        log.info("[ADB] Typing text: {}", text.length() > 50 ? text.substring(0, 50) + "..." : text);
        return runner.shell("input", "text", escapeText(text));
    }

    @Override
    public DeviceCommandResult swipe(String direction) {
        ensureConnected();
        return swipe(direction, properties.getDevice().getSwipeDurationMs());
    }

    private DeviceCommandResult swipe(String direction, int durationMs) {
        int[] coords = swipeCoordinates(direction);
        if (coords == null) {
            return DeviceCommandResult.failure("Invalid direction: " + direction + ". Use up/down/left/right.");
        }
        log.info("[ADB] Swipe {}", direction);
        return runner.shell("input", "swipe",
                String.valueOf(coords[0]), String.valueOf(coords[1]),
                String.valueOf(coords[2]), String.valueOf(coords[3]),
                String.valueOf(durationMs));
    }

    int[] swipeCoordinates(String direction) {
        PhoneAgentProperties.DeviceProperties device = properties.getDevice();
        int cx = device.getScreenCenterX();
        int cy = device.getScreenCenterY();
        int d = device.getSwipeDistance();
        return switch (direction == null ? "" : direction.toLowerCase(Locale.ROOT)) {
        case "up" -> new int[] { cx, cy + d, cx, cy - d };
        case "down" -> new int[] { cx, cy - d, cx, cy + d };
        case "left" -> new int[] { cx + d, cy, cx - d, cy };
        case "right" -> new int[] { cx - d, cy, cx + d, cy };
        default -> null;
        };
    }

    @Override
    public DeviceCommandResult pressKey(String key) {
        String keyCode = KEY_CODES.get(key.toLowerCase(Locale.ROOT));
        if (keyCode == null) {
            return DeviceCommandResult.failure("Unknown key: " + key + ". Available: "
                    + String.join(", ", KEY_CODES.keySet().stream().sorted().toList()));
        }
        ensureConnected();
        log.info("[ADB] Key {}", key);
        return runner.shell("input", "keyevent", keyCode);
    }

    @Override
    public DeviceCommandResult launchApp(String packageName) {
        ensureConnected();
        log.info("[ADB] Launching {}", packageName);
        DeviceCommandResult result = runner.shell("monkey", "-p", packageName,
                "-c", "android.intent.category.LAUNCHER", "1");
        if (result.isSuccess() && result.getOutput() != null && result.getOutput().contains("No activities found")) {
            return DeviceCommandResult.failure("No launchable activity in " + packageName);
        }
        return result;
    }

    @Override
    public DeviceCommandResult wake() {
        DeviceCommandResult connect = ensureConnected();
        if (!connect.isSuccess()) {
            return connect;
        }
        DeviceCommandResult power = runner.shell("dumpsys", "power");
        if (power.isSuccess() && !isScreenOff(power.getOutput())) {
            return DeviceCommandResult.success("Screen already on");
        }
        log.info("[ADB] Waking device");
        DeviceCommandResult wakeup = runner.shell("input", "keyevent", "KEYCODE_WAKEUP");
        if (!wakeup.isSuccess()) {
            return wakeup;
        }
        return swipe("up", UNLOCK_SWIPE_MS);
    }

    @Override
    public DeviceInfo describe() {
        String serial = runner.getSerial();
        DeviceCommandResult connect = ensureConnected();
        if (!connect.isSuccess()) {
            return DeviceInfo.disconnected(serial, connect.getError());
        }
        DeviceCommandResult ping = runner.shell("echo", "ping");
        if (!ping.isSuccess() || ping.getOutput() == null || !ping.getOutput().contains("ping")) {
            connected = false;
            return DeviceInfo.disconnected(serial, ping.getError() != null ? ping.getError() : "Device not responding");
        }
        return DeviceInfo.builder()
                .connected(true)
                .serial(serial)
                .model(property("ro.product.model"))
                .androidVersion(property("ro.build.version.release"))
                .buildId(property("ro.build.display.id"))
                .batteryLevel(batteryLevel())
                .build();
    }

    private DeviceCommandResult ensureConnected() {
        if (connected) {
            return DeviceCommandResult.success("already connected");
        }
        DeviceCommandResult result = runner.connect();
        if (result.isSuccess()) {
            connected = true;
        } else {
            log.warn("[ADB] Connect failed: {}", result.getError());
        }
        return result;
    }

    private String property(String name) {
        DeviceCommandResult result = runner.shell("getprop", name);
        return result.isSuccess() && result.getOutput() != null ? result.getOutput().trim() : null;
    }

    private Integer batteryLevel() {
        DeviceCommandResult result = runner.shell("dumpsys", "battery");
        if (!result.isSuccess() || result.getOutput() == null) {
            return null;
        }
        Matcher matcher = BATTERY_LEVEL.matcher(result.getOutput());
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    static boolean isScreenOff(String dumpsysPower) {
        if (dumpsysPower == null) {
            return true;
        }
        return dumpsysPower.contains("Display Power: state=OFF")
                || dumpsysPower.contains("mWakefulness=Asleep")
                || dumpsysPower.contains("mWakefulness=Dozing");
    }

    static String escapeText(String text) {
        StringBuilder escaped = new StringBuilder(text.length() + 8);
        for (char c : text.toCharArray()) {
            if (c == ' ') {
                escaped.append("%s");
            } else if (SHELL_SPECIALS.indexOf(c) >= 0) {
                escaped.append('\\').append(c);
            } else {
                escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
