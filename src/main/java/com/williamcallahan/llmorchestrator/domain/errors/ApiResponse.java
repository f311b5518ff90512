package com.williamcallahan.llmorchestrator.domain.errors;

/**
 * Defines the shared contract for JSON API responses so controllers can return consistent payloads.
 *
 * <p>The response contract is framework-free so the payloads can be reused by any delivery
 * mechanism.</p>
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse, ApiCompletionResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return response status for client handling
     */
    String status();
}
