package com.logstore.storage.config;

import com.logstore.common.exception.ErrorCode;
import com.logstore.common.exception.LogStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import javax.servlet.http.HttpServletRequest;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LogStoreException.class)
    public ResponseEntity<Map<String, Object>> handleLogStoreException(LogStoreException ex,
                                                                       HttpServletRequest request) {
        log.warn("Rejected {} {}: {} - {} {}", request.getMethod(), request.getRequestURI(),
                ex.getErrorCode(), ex.getMessage(), ex.getDetails());

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().toString());
        response.put("path", request.getRequestURI());
        response.put("errorCode", ex.getCode());
        response.put("errorType", ex.getErrorCode().name());
        response.put("message", ex.getMessage());
        if (!ex.getDetails().isEmpty()) {
            response.put("details", ex.getDetails());
        }

        return ResponseEntity.status(mapErrorCodeToHttpStatus(ex.getErrorCode())).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected exception on {} {}", request.getMethod(), request.getRequestURI(), ex);

        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now().toString());
        response.put("path", request.getRequestURI());
        response.put("errorCode", ErrorCode.UNKNOWN_ERROR.getCode());
        response.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        int code = errorCode.getCode();

        if (code >= 1000 && code < 2000) {
            return HttpStatus.BAD_REQUEST;
        } else if (errorCode == ErrorCode.STREAM_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        } else if (code >= 3000 && code < 5000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
