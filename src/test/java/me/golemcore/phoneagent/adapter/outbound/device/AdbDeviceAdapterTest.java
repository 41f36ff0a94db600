package me.golemcore.phoneagent.adapter.outbound.device;

import me.golemcore.phoneagent.domain.model.DeviceCommandResult;
import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.domain.model.ScreenCaptureException;
import me.golemcore.phoneagent.domain.model.ScreenState;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdbDeviceAdapterTest {

    private static final String DUMP = "<hierarchy rotation=\"0\"><node text=\"OK\" clickable=\"true\" "
            + "package=\"com.example\" bounds=\"[0,0][100,100]\" /></hierarchy>";

    private AdbCommandRunner runner;
    private AdbDeviceAdapter adapter;

    @BeforeEach
    void setUp() {
        runner = mock(AdbCommandRunner.class);
        adapter = new AdbDeviceAdapter(runner, new UiHierarchyParser(), new PhoneAgentProperties());
        when(runner.connect()).thenReturn(DeviceCommandResult.success("connected to 10.0.0.5:5555"));
        when(runner.getSerial()).thenReturn("10.0.0.5:5555");
    }

    @Test
    void shouldCaptureScreenshotAndHierarchy() {
        byte[] png = "png-bytes".getBytes(StandardCharsets.UTF_8);
        when(runner.execOut("screencap", "-p")).thenReturn(new AdbCommandRunner.BinaryResult(true, png, null));
        when(runner.shell("uiautomator", "dump", AdbDeviceAdapter.DUMP_PATH))
                .thenReturn(DeviceCommandResult.success("UI hierchary dumped to: /sdcard/ui_dump.xml"));
        when(runner.shell("cat", AdbDeviceAdapter.DUMP_PATH)).thenReturn(DeviceCommandResult.success(DUMP + "\n"));
        when(runner.shell("rm", "-f", AdbDeviceAdapter.DUMP_PATH)).thenReturn(DeviceCommandResult.success(""));

        ScreenState state = adapter.captureState();

        assertArrayEquals(png, Base64.getDecoder().decode(state.getScreenshotBase64()));
        assertEquals(DUMP, state.getHierarchyXml());
        assertEquals(1, state.getElements().size());
        assertEquals("com.example", state.getDominantPackage());
        verify(runner).shell("rm", "-f", AdbDeviceAdapter.DUMP_PATH);
    }

    @Test
    void shouldFailCaptureAndReconnectWhenScreenshotFails() {
        when(runner.execOut("screencap", "-p"))
                .thenReturn(new AdbCommandRunner.BinaryResult(false, new byte[0], "device offline"));

        ScreenCaptureException error = assertThrows(ScreenCaptureException.class, adapter::captureState);
        assertThrows(ScreenCaptureException.class, adapter::captureState);

        assertEquals("Screenshot failed: device offline", error.getMessage());
        verify(runner, times(2)).connect();
    }

    @Test
    void shouldFailCaptureWhenDumpHasNoHierarchy() {
        when(runner.execOut("screencap", "-p"))
                .thenReturn(new AdbCommandRunner.BinaryResult(true, new byte[] { 1 }, null));
        when(runner.shell("uiautomator", "dump", AdbDeviceAdapter.DUMP_PATH))
                .thenReturn(DeviceCommandResult.success(""));
        when(runner.shell("cat", AdbDeviceAdapter.DUMP_PATH))
                .thenReturn(DeviceCommandResult.success("cat: /sdcard/ui_dump.xml: No such file"));

        ScreenCaptureException error = assertThrows(ScreenCaptureException.class, adapter::captureState);

        assertTrue(error.getMessage().startsWith("UI dump could not be read"));
    }

    @Test
    void shouldConnectOnceAcrossCommands() {
        when(runner.shell("input", "tap", "10", "20")).thenReturn(DeviceCommandResult.success(""));

        adapter.tap(10, 20);
        adapter.tap(10, 20);

        verify(runner, times(1)).connect();
        verify(runner, times(2)).shell("input", "tap", "10", "20");
    }

    @Test
    void shouldSwipeFromConfiguredCenter() {
        assertArrayEquals(new int[] { 540, 1700, 540, 700 }, adapter.swipeCoordinates("up"));
        assertArrayEquals(new int[] { 540, 700, 540, 1700 }, adapter.swipeCoordinates("down"));
        assertArrayEquals(new int[] { 1040, 1200, 40, 1200 }, adapter.swipeCoordinates("left"));
        assertArrayEquals(new int[] { 40, 1200, 1040, 1200 }, adapter.swipeCoordinates("right"));
        assertNull(adapter.swipeCoordinates("diagonal"));
    }

    @Test
    void shouldSendSwipeWithDuration() {
        when(runner.shell("input", "swipe", "540", "700", "540", "1700", "300"))
                .thenReturn(DeviceCommandResult.success(""));

        DeviceCommandResult result = adapter.swipe("down");

        assertTrue(result.isSuccess());
    }

    @Test
    void shouldEscapeTextForDeviceShell() {
        assertEquals("Hello%sworld", AdbDeviceAdapter.escapeText("Hello world"));
        assertEquals("it\\'s%s\\$5%s\\&%sup", AdbDeviceAdapter.escapeText("it's $5 & up"));
        assertEquals("\\(a\\|b\\)", AdbDeviceAdapter.escapeText("(a|b)"));
    }

    @Test
    void shouldRejectUnknownKeyWithoutDeviceCall() {
        DeviceCommandResult result = adapter.pressKey("escape");

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Unknown key: escape. Available: back, delete, enter"));
        verify(runner, never()).connect();
    }

    @Test
    void shouldMapKeyNamesToKeyCodes() {
        when(runner.shell("input", "keyevent", "KEYCODE_BACK")).thenReturn(DeviceCommandResult.success(""));

        assertTrue(adapter.pressKey("BACK").isSuccess());
    }

    @Test
    void shouldReportMissingLauncherActivity() {
        when(runner.shell("monkey", "-p", "com.missing", "-c", "android.intent.category.LAUNCHER", "1"))
                .thenReturn(DeviceCommandResult.success("** No activities found to run, monkey aborted."));

        DeviceCommandResult result = adapter.launchApp("com.missing");

        assertFalse(result.isSuccess());
        assertEquals("No launchable activity in com.missing", result.getError());
    }

    @Test
    void shouldSkipWakeWhenScreenIsOn() {
        when(runner.shell("dumpsys", "power"))
                .thenReturn(DeviceCommandResult.success("Display Power: state=ON\nmWakefulness=Awake"));

        DeviceCommandResult result = adapter.wake();

        assertTrue(result.isSuccess());
        verify(runner, never()).shell("input", "keyevent", "KEYCODE_WAKEUP");
    }

    @Test
    void shouldWakeAndSwipeWhenScreenIsOff() {
        when(runner.shell("dumpsys", "power"))
                .thenReturn(DeviceCommandResult.success("Display Power: state=OFF\nmWakefulness=Asleep"));
        when(runner.shell("input", "keyevent", "KEYCODE_WAKEUP")).thenReturn(DeviceCommandResult.success(""));
        when(runner.shell("input", "swipe", "540", "1700", "540", "700", "200"))
                .thenReturn(DeviceCommandResult.success(""));

        DeviceCommandResult result = adapter.wake();

        assertTrue(result.isSuccess());
        verify(runner).shell("input", "swipe", "540", "1700", "540", "700", "200");
    }

    @Test
    void shouldDescribeConnectedDevice() {
        when(runner.shell("echo", "ping")).thenReturn(DeviceCommandResult.success("ping\n"));
        when(runner.shell("getprop", "ro.product.model")).thenReturn(DeviceCommandResult.success("Pixel 7\n"));
        when(runner.shell("getprop", "ro.build.version.release")).thenReturn(DeviceCommandResult.success("14"));
        when(runner.shell("getprop", "ro.build.display.id")).thenReturn(DeviceCommandResult.success("UQ1A"));
        when(runner.shell("dumpsys", "battery"))
                .thenReturn(DeviceCommandResult.success("Current Battery Service state:\n  level: 87\n  scale: 100"));

        DeviceInfo info = adapter.describe();

        assertTrue(info.isConnected());
        assertEquals("10.0.0.5:5555", info.getSerial());
        assertEquals("Pixel 7", info.getModel());
        assertEquals("14", info.getAndroidVersion());
        assertEquals(87, info.getBatteryLevel());
    }

    @Test
    void shouldDescribeUnreachableDevice() {
        when(runner.connect()).thenReturn(DeviceCommandResult.failure("unable to connect to 10.0.0.5:5555"));

        DeviceInfo info = adapter.describe();

        assertFalse(info.isConnected());
        assertEquals("unable to connect to 10.0.0.5:5555", info.getError());
    }
}
