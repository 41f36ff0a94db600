package me.golemcore.phoneagent.domain.service;

import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import me.golemcore.phoneagent.port.outbound.DevicePort;
import me.golemcore.phoneagent.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceHealthServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private DevicePort devicePort;
    private MutableClock clock;
    private DeviceHealthService service;

    @BeforeEach
    void setUp() {
        devicePort = mock(DevicePort.class);
        clock = new MutableClock(START);
        PhoneAgentProperties properties = new PhoneAgentProperties();
        properties.getDevice().setHealthCacheTtlMs(30_000);
        service = new DeviceHealthService(devicePort, properties, clock);
        when(devicePort.describe()).thenReturn(DeviceInfo.builder()
                .connected(true)
                .serial("192.168.1.50:5555")
                .model("Pixel 7")
                .build());
    }

    @Test
    void shouldStampCheckTime() {
        DeviceInfo info = service.check();

        assertTrue(info.isConnected());
        assertEquals("Pixel 7", info.getModel());
        assertEquals(START, info.getCheckedAt());
    }

    @Test
    void shouldServeCachedResultWithinTtl() {
        DeviceInfo first = service.check();
        clock.advance(Duration.ofSeconds(29));

        DeviceInfo second = service.check();

        assertSame(first, second);
        verify(devicePort, times(1)).describe();
    }

    @Test
    void shouldProbeAgainAfterTtl() {
        service.check();
        clock.advance(Duration.ofSeconds(30));
        when(devicePort.describe()).thenReturn(DeviceInfo.disconnected("192.168.1.50:5555", "offline"));

        DeviceInfo info = service.check();

        assertFalse(info.isConnected());
        assertEquals("offline", info.getError());
        assertEquals(START.plusSeconds(30), info.getCheckedAt());
        verify(devicePort, times(2)).describe();
    }

    @Test
    void shouldProbeAgainAfterInvalidate() {
        service.check();

        service.invalidate();
        service.check();

        verify(devicePort, times(2)).describe();
    }
}
