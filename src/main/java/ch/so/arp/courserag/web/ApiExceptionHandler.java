package ch.so.arp.courserag.web;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import ch.so.arp.courserag.llm.LlmClientException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps failures of a query to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LlmClientException.class)
    public ResponseEntity<ApiError> handleLlmClient(LlmClientException ex, HttpServletRequest request) {
        LOGGER.error("Language model call failed for {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ApiError("LLM_UNAVAILABLE", ex.getMessage(), request.getRequestURI(), Instant.now()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(new ApiError("VALIDATION_FAILED", "Query must not be blank", request.getRequestURI(),
                        Instant.now()));
    }
}
