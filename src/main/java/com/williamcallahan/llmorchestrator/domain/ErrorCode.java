package com.williamcallahan.llmorchestrator.domain;

/**
 * Caller-facing terminal failure codes.
 */
public enum ErrorCode {
    /** A rate-limit scope denied the request; retry after the hinted delay. */
    RATE_LIMITED,
    /** Spend limits or the request's own cost ceiling prevent every candidate. */
    BUDGET_EXCEEDED,
    /** Every candidate provider failed; diagnostics list each reason. */
    ALL_PROVIDERS_EXHAUSTED,
    /** The request itself is invalid or unauthorized; retrying elsewhere will not help. */
    FATAL_REQUEST_ERROR,
    /** The request deadline passed before a result was available. */
    TIMEOUT,
    /** The caller cancelled the request. */
    CANCELLED,
    /** A stream failed after delivering output; the delivered part stands and no fallback happens. */
    STREAM_INTERRUPTED
}
