package com.beacon.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.beacon.observability.CorrelationContext;
import com.beacon.observability.CorrelationContextHolder;
import jakarta.servlet.ServletException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Unit tests for {@link GlobalExceptionHandler}.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:30:00Z");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("treats an IllegalArgumentException from inside a controller as a server fault")
    void handlesIllegalArgumentAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new IllegalArgumentException("duplicate dependency name: redis"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("keeps 404 for an unknown resource")
    void keepsNotFound() {
        ResponseEntity<ProblemDetail> result =
                handler.handleFramework(new NoResourceFoundException(HttpMethod.GET, "favicon.ico"));

        assertThat(result.getStatusCode().value()).isEqualTo(404);
        assertThat(result.getBody().getStatus()).isEqualTo(404);
        assertThat(result.getBody().getProperties()).containsEntry("timestamp", "2026-01-01T10:30:00Z");
    }

    @Test
    @DisplayName("keeps 405 and the Allow header for an unsupported method")
    void keepsMethodNotAllowed() {
        ResponseEntity<ProblemDetail> result =
                handler.handleFramework(new HttpRequestMethodNotSupportedException("POST", List.of("GET")));

        assertThat(result.getStatusCode().value()).isEqualTo(405);
        assertThat(result.getHeaders().getFirst(HttpHeaders.ALLOW)).isEqualTo("GET");
    }

    @Test
    @DisplayName("answers a servlet exception without a status with a generic 500")
    void handlesPlainServletExceptionAsInternalError() {
        ResponseEntity<ProblemDetail> result =
                handler.handleFramework(new ServletException("filter blew up"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody().getDetail()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("maps any other exception to a generic 500 without leaking its message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new IllegalStateException("password=hunter2"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).isEqualTo("An unexpected error occurred");
        assertThat(result.getType().toString()).isEqualTo("https://beacon.dev/errors/internal");
    }

    @Test
    @DisplayName("includes timestamp and correlation ID")
    void errorResponseIncludesTimestampAndCorrelationId() {
        CorrelationContextHolder.set(new CorrelationContext("corr-42", "/boom", null));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties())
                .containsEntry("timestamp", "2026-01-01T10:30:00Z")
                .containsEntry("correlationId", "corr-42");
    }
}
