package me.golemcore.pragent.adapter.inbound.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapInvalidInputToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Invalid agent instance id")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
                    assertEquals(400, resp.getBody().getStatus());
                    assertEquals("Invalid agent instance id", resp.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapRunningTaskToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("A task is running on agent a")))
                .assertNext(resp -> assertEquals(HttpStatus.CONFLICT, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldKeepExplicitStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "token is required")))
                .assertNext(resp -> assertEquals("token is required", resp.getBody().getMessage()))
                .verifyComplete();
    }

    @Test
    void shouldHideUnexpectedFailureDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret stack detail")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, resp.getStatusCode());
                    assertEquals("Internal server error", resp.getBody().getMessage());
                })
                .verifyComplete();
    }
}
