package me.golemcore.phoneagent.adapter.inbound.web.controller;

import me.golemcore.phoneagent.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.phoneagent.domain.model.PhoneTask;
import me.golemcore.phoneagent.domain.model.StartTaskCommand;
import me.golemcore.phoneagent.domain.model.TaskStatus;
import me.golemcore.phoneagent.domain.service.PhoneTaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PhoneTasksControllerWebTest {

    private PhoneTaskService phoneTaskService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        phoneTaskService = mock(PhoneTaskService.class);
        webTestClient = WebTestClient.bindToController(new PhoneTasksController(phoneTaskService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldAcceptStartRequest() {
        when(phoneTaskService.start(any(StartTaskCommand.class))).thenReturn(PhoneTask.builder()
                .id("a1b2c3d4")
                .goal("Open settings")
                .status(TaskStatus.PENDING)
                .createdAt(Instant.parse("2026-03-01T10:00:00Z"))
                .build());

        webTestClient.post()
                .uri("/api/phone/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("goal", "Open settings", "maxSteps", 10))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.taskId").isEqualTo("a1b2c3d4")
                .jsonPath("$.status").isEqualTo("pending");
    }

    @Test
    void shouldMapValidationFailureToBadRequest() {
        when(phoneTaskService.start(any(StartTaskCommand.class)))
                .thenThrow(new IllegalArgumentException("maxSteps must be between 1 and 100, got 500"));

        webTestClient.post()
                .uri("/api/phone/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("goal", "Open settings", "maxSteps", 500))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("maxSteps must be between 1 and 100, got 500");
    }

    @Test
    void shouldMapFullRegistryToConflict() {
        when(phoneTaskService.start(any(StartTaskCommand.class)))
                .thenThrow(new IllegalStateException("Task registry is full (100 active tasks)"));

        webTestClient.post()
                .uri("/api/phone/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("goal", "Open settings"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Task registry is full (100 active tasks)");
    }

    @Test
    void shouldReturnNotFoundBody() {
        when(phoneTaskService.getStatus("missing1")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/phone/tasks/missing1")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404)
                .jsonPath("$.message").isEqualTo("Task not found: missing1");
    }

    @Test
    void shouldRejectUnknownStatusFilter() {
        when(phoneTaskService.list("paused", null)).thenThrow(new IllegalArgumentException("Unknown status: paused"));

        webTestClient.get()
                .uri("/api/phone/tasks?status=paused")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unknown status: paused");
    }
}
