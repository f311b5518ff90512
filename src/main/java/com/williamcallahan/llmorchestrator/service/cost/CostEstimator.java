package com.williamcallahan.llmorchestrator.service.cost;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.provider.ModelRequest;
import com.williamcallahan.llmorchestrator.service.provider.ModelResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Converts token counts into whole-cent costs using a provider's per-1k-token rate.
 *
 * <p>All amounts are rounded up to the next cent so that estimates stay pessimistic and no
 * fractional spend is ever lost between reservation and commit.</p>
 */
public class CostEstimator {
    private static final BigDecimal TOKENS_PER_RATE_UNIT = BigDecimal.valueOf(1000);

    private final TokenCounter tokenCounter;

    public CostEstimator(TokenCounter tokenCounter) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
    }

    /**
     * Estimates the worst-case cost of a call: full prompt plus the maximum output.
     */
    public long estimateCents(ProviderDescriptor descriptor, ModelRequest request) {
        long promptTokens = tokenCounter.countTokens(request.prompt());
        return centsForTokens(descriptor, promptTokens + request.maxOutputTokens());
    }

    /**
     * Computes the actual cost from provider-reported usage, counting tokens locally when the
     * provider did not report them.
     */
    public long actualCents(ProviderDescriptor descriptor, ModelRequest request, ModelResponse response) {
        if (response.hasReportedUsage()) {
            return centsForTokens(descriptor, response.promptTokens() + response.completionTokens());
        }
        return streamedCents(descriptor, request, response.text());
    }

    /**
     * Computes the cost of a stream from the prompt and the text delivered so far.
     */
    public long streamedCents(ProviderDescriptor descriptor, ModelRequest request, String deliveredText) {
        long tokens = (long) tokenCounter.countTokens(request.prompt()) + tokenCounter.countTokens(deliveredText);
        return centsForTokens(descriptor, tokens);
    }

    /**
     * Converts a token count to cents, rounding up.
     */
    public long centsForTokens(ProviderDescriptor descriptor, long tokens) {
        if (tokens <= 0) {
            return 0L;
        }
        return descriptor.costPerKTokenCents()
                .multiply(BigDecimal.valueOf(tokens))
                .divide(TOKENS_PER_RATE_UNIT, 0, RoundingMode.CEILING)
                .longValueExact();
    }
}
