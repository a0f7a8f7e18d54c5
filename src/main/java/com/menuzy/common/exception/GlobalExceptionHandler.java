package com.menuzy.common.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Maps exceptions thrown by controllers to RFC 9457 {@link ProblemDetail} bodies.
 *
 * <pre>{@code
 * {
 *   "type": "https://menuzy.com/errors/restaurant_not_found",
 *   "title": "Restaurant not found",
 *   "status": 404,
 *   "detail": "Restaurant 42 not found"
 * }
 * }</pre>
 *
 * Catalog load failures never reach this handler: the loader reports them as a
 * {@code LoadResult} value.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://menuzy.com/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        log.warn("Business exception: {}", e.getMessage());
        return problem(e.getErrorCode(), e.getMessage());
    }

    /**
     * Bean Validation failures on request parameters of {@code @Validated} controllers.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ProblemDetail> handleConstraintViolation(ConstraintViolationException e) {
        String detail = e.getConstraintViolations().stream()
                .map(violation -> lastNode(violation.getPropertyPath().toString()) + ": " + violation.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", detail);
        return problem(ErrorCode.INVALID_INPUT, detail);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Request parameter type mismatch: {}", e.getMessage());
        return problem(ErrorCode.INVALID_INPUT, e.getName() + ": has an invalid value");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return problem(ErrorCode.INVALID_INPUT, e.getParameterName() + ": is required");
    }

    // Malformed JSON, or a value of the wrong type (e.g. text where a number belongs).
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return problem(ErrorCode.INVALID_INPUT, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleException(Exception e) {
        log.error("Unexpected error", e);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
        return ResponseEntity.internalServerError().body(problem);
    }

    // "load.timeoutSeconds" -> "timeoutSeconds"
    private static String lastNode(String path) {
        return path.substring(path.lastIndexOf('.') + 1);
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setTitle(errorCode.getMessage());
        return ResponseEntity.status(errorCode.getStatus()).body(problem);
    }
}
