package org.caureq.hostwatch.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.service.NotFoundException;
import org.caureq.hostwatch.service.alerts.InvalidCheckConfigException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> Map.of("field", f.getField(), "message", String.valueOf(f.getDefaultMessage())))
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req),
                        Map.of("fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed request", cid(req), Map.of())
        );
    }

    @ExceptionHandler(InvalidCheckConfigException.class)
    public ResponseEntity<ApiError> handleCheckConfig(InvalidCheckConfigException ex,
                                                      HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.INVALID_CHECK_CONFIG, ex.getMessage(), cid(req),
                        Map.of("checkKey", String.valueOf(ex.checkKey())))
        );
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex,
                                                       HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.CONFLICT, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
