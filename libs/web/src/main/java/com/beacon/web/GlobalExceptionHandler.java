package com.beacon.web;

import com.beacon.observability.CorrelationContextHolder;
import jakarta.servlet.ServletException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions that escape a controller to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Dependency failures never get here: probes turn them into data. Framework errors that carry
 * their own status, such as an unknown path (404) or an unsupported method (405), keep it. Anything
 * else is a genuine server fault, answered with a generic 500 that does not leak internal detail:
 *
 * <pre>
 * {
 *   "type": "https://beacon.dev/errors/internal",
 *   "title": "Internal Server Error",
 *   "status": 500,
 *   "detail": "An unexpected error occurred",
 *   "timestamp": "2026-01-01T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://beacon.dev/errors/";
    static final String GENERIC_DETAIL = "An unexpected error occurred";

    private final Clock clock;

    public GlobalExceptionHandler() {
        this(Clock.systemUTC());
    }

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<ProblemDetail> handleFramework(Exception ex) {
        if (!(ex instanceof ErrorResponse response)) {
            return ResponseEntity.internalServerError().body(handleGeneric(ex));
        }
        log.debug("Request rejected with {}: {}", response.getStatusCode(), ex.getMessage());
        ProblemDetail body = response.getBody();
        decorate(body);
        return ResponseEntity.status(response.getStatusCode())
                .headers(response.getHeaders())
                .body(body);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", GENERIC_DETAIL);
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        decorate(problem);
        return problem;
    }

    private void decorate(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now(clock).toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
