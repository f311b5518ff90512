package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {
    private static final String HDR_FORWARDED_FOR = "X-Forwarded-For";

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    protected ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /**
     * Handles bean validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    protected ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException invalidBody) {
        String message = invalidBody.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request body");
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * Handles unparseable request bodies.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    protected ResponseEntity<ApiResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    /**
     * Resolves the caller address, preferring the first hop of {@code X-Forwarded-For}.
     */
    protected String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(HDR_FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma < 0 ? forwarded : forwarded.substring(0, comma)).trim();
        }
        return request.getRemoteAddr();
    }
}
