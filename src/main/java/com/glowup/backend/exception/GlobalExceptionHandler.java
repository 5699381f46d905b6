package com.glowup.backend.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleStatusException(ResponseStatusException exc) {
        return ResponseEntity.status(exc.getStatusCode()).body(detail(exc.getReason()));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MultipartException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception exc) {
        return ResponseEntity.badRequest().body(detail(exc.getMessage()));
    }

    /**
     * Spring MVC's own request errors (missing parameter or part, unsupported method or
     * media type, unknown resource) carry their status and stay client errors.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneralException(Exception exc) {
        if (exc instanceof ErrorResponse errorResponse) {
            String message = errorResponse.getBody().getDetail();
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .headers(errorResponse.getHeaders())
                    .body(detail(message != null ? message : exc.getMessage()));
        }

        log.error("Unhandled error", exc);
        Map<String, String> response = new HashMap<>();
        response.put("error", "Internal Server Error");
        response.put("message", exc.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private static Map<String, String> detail(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("detail", message);
        return response;
    }
}
