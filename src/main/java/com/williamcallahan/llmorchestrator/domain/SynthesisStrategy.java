package com.williamcallahan.llmorchestrator.domain;

/**
 * How one answer is chosen when the same request is sent to several providers.
 */
public enum SynthesisStrategy {
    /** Most frequent answer text; ties go to the better-ranked provider. */
    MAJORITY_VOTE,
    /** Answer with the largest summed provider weight among providers that returned it. */
    QUALITY_WEIGHTED,
    /** Answer of the best-ranked provider that succeeded. */
    FIRST_VALID
}
