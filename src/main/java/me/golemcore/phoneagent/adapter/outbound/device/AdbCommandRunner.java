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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@code adb} CLI against the configured device with a per-command
 * timeout. A command that outlives its timeout is killed and reported as a
 * failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdbCommandRunner {

    private static final int MAX_TEXT_OUTPUT = 2 * 1024 * 1024;

    private final PhoneAgentProperties properties;

    private final ExecutorService outputReader = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "adb-output");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Binary command output, used for screenshots.
     */
    public record BinaryResult(boolean success, byte[] data, String error) {
    }

    public String getSerial() {
        PhoneAgentProperties.DeviceProperties device = properties.getDevice();
        if (device.getHost() == null || device.getHost().isBlank()) {
            return null;
        }
        return device.getHost().trim() + ":" + device.getPort();
    }

    /**
     * {@code adb connect host:port}.
     */
    public DeviceCommandResult connect() {
        String serial = getSerial();
        if (serial == null) {
            return DeviceCommandResult.failure("Device host is not configured (phone.device.host)");
        }
        DeviceCommandResult result = runText(command(false, "connect", serial));
        if (result.isSuccess() && result.getOutput() != null
                && (result.getOutput().contains("failed") || result.getOutput().contains("unable"))) {
            return DeviceCommandResult.failure(result.getOutput().trim());
        }
        return result;
    }

    /**
     * {@code adb -s serial shell <args>}.
     */
    public DeviceCommandResult shell(String... args) {
        if (getSerial() == null) {
            return DeviceCommandResult.failure("Device host is not configured (phone.device.host)");
        }
        List<String> full = new ArrayList<>();
        full.add("shell");
        full.addAll(Arrays.asList(args));
        return runText(command(true, full.toArray(new String[0])));
    }

    /**
     * {@code adb -s serial exec-out <args>} capturing raw bytes.
     */
    public BinaryResult execOut(String... args) {
        if (getSerial() == null) {
            return new BinaryResult(false, new byte[0], "Device host is not configured (phone.device.host)");
        }
        List<String> full = new ArrayList<>();
        full.add("exec-out");
        full.addAll(Arrays.asList(args));
        ProcessOutput output = execute(command(true, full.toArray(new String[0])), false);
        if (output.error() != null) {
            return new BinaryResult(false, new byte[0], output.error());
        }
        if (output.exitCode() != 0) {
            return new BinaryResult(false, new byte[0], "adb exited with code " + output.exitCode());
        }
        return new BinaryResult(true, output.stdout(), null);
    }

    private List<String> command(boolean targeted, String... args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getDevice().getAdbPath());
        if (targeted) {
            command.add("-s");
            command.add(getSerial());
        }
        command.addAll(Arrays.asList(args));
        return command;
    }

    private DeviceCommandResult runText(List<String> command) {
        ProcessOutput output = execute(command, true);
        if (output.error() != null) {
            return DeviceCommandResult.failure(output.error());
        }
        String text = new String(output.stdout(), StandardCharsets.UTF_8);
        if (text.length() > MAX_TEXT_OUTPUT) {
            text = text.substring(0, MAX_TEXT_OUTPUT);
        }
        if (output.exitCode() != 0) {
            String message = text.isBlank() ? "adb exited with code " + output.exitCode() : text.trim();
            return DeviceCommandResult.builder()
                    .success(false)
                    .output(text)
                    .error(message)
                    .build();
        }
        return DeviceCommandResult.success(text);
    }

    private ProcessOutput execute(List<String> command, boolean mergeStderr) {
        long timeoutMs = properties.getDevice().getCommandTimeoutMs();
        log.trace("[ADB] {}", command);

        ProcessBuilder pb = new ProcessBuilder(command);
        if (mergeStderr) {
            pb.redirectErrorStream(true);
        } else {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ProcessOutput.failed("Failed to run adb: " + e.getMessage());
        }

        Future<byte[]> stdout = outputReader.submit(() -> readAll(process.getInputStream()));
        try {
            boolean completed = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                stdout.cancel(true);
                log.warn("[ADB] Command timed out after {}ms: {}", timeoutMs, command);
                return ProcessOutput.failed("ADB command timed out after " + timeoutMs + "ms");
            }
            byte[] bytes = stdout.get(1, TimeUnit.SECONDS);
            return new ProcessOutput(process.exitValue(), bytes, null);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ProcessOutput.failed("ADB command interrupted");
        } catch (ExecutionException e) {
            return ProcessOutput.failed("Error reading adb output: " + e.getCause().getMessage());
        } catch (TimeoutException e) {
            return ProcessOutput.failed("Timed out reading adb output");
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            in.transferTo(out);
            return out.toByteArray();
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReader.shutdownNow();
    }

    private record ProcessOutput(int exitCode, byte[] stdout, String error) {
        static ProcessOutput failed(String error) {
            return new ProcessOutput(-1, new byte[0], error);
        }
    }
}
