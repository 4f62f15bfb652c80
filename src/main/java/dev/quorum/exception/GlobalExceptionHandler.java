package dev.quorum.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * RFC 7807 Problem Details for the config and history endpoints.
 *
 * <p>Internal exception messages are not exposed for unexpected errors;
 * details are logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request", "Invalid Request");
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Rejected request body or parameter: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Request body or parameter is invalid.", "bad-request",
                "Invalid Request");
    }

    @ExceptionHandler({InstallationNotFoundException.class, ReviewNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleConflict(IllegalStateException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "state-conflict", "State Conflict");
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.",
                "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ProblemDetail handleFrameworkError(ErrorResponseException ex) {
        return ex.getBody();
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://quorum.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
