package com.williamcallahan.llmorchestrator.service.cost;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.provider.ModelRequest;
import com.williamcallahan.llmorchestrator.service.provider.ModelResponse;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Verifies token-to-cent conversion and the choice between reported and locally counted usage.
 */
class CostEstimatorTest {
    private static final String PROMPT = "Compare ConcurrentHashMap with Collections.synchronizedMap.";
    private static final int MAX_OUTPUT_TOKENS = 500;

    private static TokenCounter tokenCounter;
    private static CostEstimator estimator;
    private static ProviderDescriptor descriptor;

    @BeforeAll
    static void setUp() {
        tokenCounter = new TokenCounter();
        estimator = new CostEstimator(tokenCounter);
        descriptor = new ProviderDescriptor(
                "openai", 1, 1.0, new BigDecimal("1.5"), 4, Duration.ofSeconds(30), "gpt-4o-mini");
    }

    @Test
    void centsForTokens_roundsPartialCentsUp() {
        assertEquals(0, estimator.centsForTokens(descriptor, 0));
        assertEquals(1, estimator.centsForTokens(descriptor, 1));
        assertEquals(2, estimator.centsForTokens(descriptor, 1_000));
        assertEquals(3, estimator.centsForTokens(descriptor, 2_000));
    }

    @Test
    void estimateCents_coversPromptAndFullOutputAllowance() {
        ModelRequest request = new ModelRequest(PROMPT, "gpt-4o-mini", 0.0, MAX_OUTPUT_TOKENS);
        long promptTokens = tokenCounter.countTokens(PROMPT);

        long estimate = estimator.estimateCents(descriptor, request);

        assertEquals(estimator.centsForTokens(descriptor, promptTokens + MAX_OUTPUT_TOKENS), estimate);
    }

    @Test
    void actualCents_prefersProviderReportedUsage() {
        ModelRequest request = new ModelRequest(PROMPT, "gpt-4o-mini", 0.0, MAX_OUTPUT_TOKENS);
        ModelResponse reported = new ModelResponse("short answer", "gpt-4o-mini", 1_200, 800);

        assertEquals(3, estimator.actualCents(descriptor, request, reported));
    }

    @Test
    void actualCents_countsLocallyWhenUsageIsUnreported() {
        ModelRequest request = new ModelRequest(PROMPT, "gpt-4o-mini", 0.0, MAX_OUTPUT_TOKENS);
        ModelResponse unreported = new ModelResponse(
                "short answer", "gpt-4o-mini", ModelResponse.UNREPORTED, ModelResponse.UNREPORTED);

        assertEquals(
                estimator.streamedCents(descriptor, request, "short answer"),
                estimator.actualCents(descriptor, request, unreported));
    }

    @Test
    void tokenCounter_treatsNullAndEmptyAsZero() {
        assertEquals(0, tokenCounter.countTokens(null));
        assertEquals(0, tokenCounter.countTokens(""));
    }
}
