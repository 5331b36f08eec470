package com.demo.thrift.config;

import com.demo.thrift.exception.ErrorKind;
import com.demo.thrift.exception.ThriftException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import jakarta.servlet.http.HttpServletRequest;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ThriftException.class)
    public ResponseEntity<Map<String, Object>> handleThrift(ThriftException ex, HttpServletRequest req) {
        HttpStatus status = ex.getKind().status();
        log.warn("{} {} rejected: {} {}", req.getMethod(), req.getRequestURI(), ex.getKind(), ex.getMessage());
        return ResponseEntity.status(status).body(body(status, ex.getKind(), ex.getMessage(), req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse(ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, message, req);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, ex.getMessage(), req);
    }

    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<Map<String, Object>> handleRouting(Exception ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
        log.debug("{} {} not routed: {}", req.getMethod(), req.getRequestURI(), status);
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "message", String.valueOf(ex.getMessage()),
                "path", req.getRequestURI()
        ));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return Map.of(
                "timestamp", Instant.now(),
                "status", 500,
                "error", "Internal Server Error",
                "message", String.valueOf(ex.getMessage()),
                "path", req.getRequestURI()
        );
    }

    private static Map<String, Object> body(HttpStatus status, ErrorKind kind, String message, HttpServletRequest req) {
        return Map.of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "kind", kind.name(),
                "message", String.valueOf(message),
                "path", req.getRequestURI()
        );
    }
}
