package me.golemcore.phoneagent.adapter.inbound.web.controller;

import me.golemcore.phoneagent.domain.model.DeviceInfo;
import me.golemcore.phoneagent.domain.service.DeviceHealthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceControllerTest {

    private DeviceHealthService deviceHealthService;
    private DeviceController controller;

    @BeforeEach
    void setUp() {
        deviceHealthService = mock(DeviceHealthService.class);
        controller = new DeviceController(deviceHealthService);
        when(deviceHealthService.check()).thenReturn(DeviceInfo.builder()
                .connected(true)
                .serial("10.0.0.5:5555")
                .batteryLevel(87)
                .build());
    }

    @Test
    void shouldReturnCachedHealth() {
        StepVerifier.create(controller.health(false))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    DeviceInfo body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isConnected());
                    assertEquals("10.0.0.5:5555", body.getSerial());
                })
                .verifyComplete();

        verify(deviceHealthService, never()).invalidate();
    }

    @Test
    void shouldInvalidateCacheOnRefresh() {
        StepVerifier.create(controller.health(true))
                .expectNextCount(1)
                .verifyComplete();

        InOrder order = inOrder(deviceHealthService);
        order.verify(deviceHealthService).invalidate();
        order.verify(deviceHealthService).check();
    }
}
