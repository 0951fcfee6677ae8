package com.vigil.agent.infrastructure.web;

import com.vigil.agent.domain.AgentNotReadyException;
import com.vigil.eventmodel.TimelineStorageException;
import com.vigil.membership.MemberNotFoundException;
import com.vigil.membership.MembershipException;
import com.vigil.observability.CycleContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions of the agent API to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://vigil.dev/errors/not-ready",
 *   "title": "Agent Not Ready",
 *   "status": 503,
 *   "detail": "agent node-1 has not completed a status collection yet",
 *   "timestamp": "2026-01-01T10:30:00Z",
 *   "cycleId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AgentNotReadyException.class)
    public ProblemDetail handleNotReady(AgentNotReadyException ex) {
        log.debug("Status requested before first collection: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Agent Not Ready", "not-ready", ex.getMessage());
    }

    @ExceptionHandler(MemberNotFoundException.class)
    public ProblemDetail handleMemberNotFound(MemberNotFoundException ex) {
        log.debug("Member lookup failed: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Member Not Found", "member-not-found", ex.getMessage());
    }

    @ExceptionHandler(MembershipException.class)
    public ProblemDetail handleMembership(MembershipException ex) {
        log.warn("Membership unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Membership Unavailable", "membership", ex.getMessage());
    }

    @ExceptionHandler(TimelineStorageException.class)
    public ProblemDetail handleTimelineStorage(TimelineStorageException ex) {
        log.warn("Timeline storage unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Timeline Unavailable", "timeline", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://vigil.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CycleContextHolder.get().ifPresent(context -> problem.setProperty("cycleId", context.cycleId()));
        return problem;
    }
}
