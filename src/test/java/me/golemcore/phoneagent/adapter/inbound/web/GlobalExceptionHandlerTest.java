package me.golemcore.phoneagent.adapter.inbound.web;

import me.golemcore.phoneagent.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldKeepStatusOfResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: abc");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Task not found: abc", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfMalformedInput() {
        ServerWebInputException ex = new ServerWebInputException("Failed to read HTTP message");

        StepVerifier.create(handler.handleMalformedInput(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(GlobalExceptionHandler.MALFORMED_REQUEST, response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Goal is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(400, response.getBody().getStatus());
                    assertEquals("Goal is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(
                new IllegalStateException("Task registry is full (100 active tasks)")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals(409, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE somewhere")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
