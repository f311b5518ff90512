package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.domain.ErrorCode;
import com.williamcallahan.llmorchestrator.domain.OrchestrationError;
import com.williamcallahan.llmorchestrator.domain.errors.ApiErrorResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Maps a terminal orchestration error to its HTTP status, adding {@code Retry-After} when the
     * error carries a retry hint.
     *
     * @param error structured error
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(OrchestrationError error) {
        ApiErrorResponse body = ApiErrorResponse.from(error);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(statusFor(error.code()));
        if (body.retryAfterSeconds() > 0) {
            builder.header(HttpHeaders.RETRY_AFTER, Long.toString(body.retryAfterSeconds()));
        }
        return builder.body(body);
    }

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds a standardized success response with a simple message.
     *
     * @param message The success message
     * @return ResponseEntity with success details
     */
    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * HTTP status for a caller-facing error code.
     */
    public HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case BUDGET_EXCEEDED -> HttpStatus.PAYMENT_REQUIRED;
            case ALL_PROVIDERS_EXHAUSTED, CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case FATAL_REQUEST_ERROR -> HttpStatus.BAD_REQUEST;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case STREAM_INTERRUPTED -> HttpStatus.BAD_GATEWAY;
        };
    }
}
