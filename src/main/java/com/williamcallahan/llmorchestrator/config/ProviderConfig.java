package com.williamcallahan.llmorchestrator.config;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.cost.BudgetLimits;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;

/**
 * One configured completion provider.
 *
 * <p>Every provider is reached through the OpenAI-compatible chat-completions protocol; OpenAI,
 * Anthropic, Gemini and local Ollama differ only in base URL, key and model.</p>
 */
public class ProviderConfig {

    private static final int PRIORITY_DEF = 100;
    private static final double WEIGHT_DEF = 1.0;
    private static final int MAX_CONCURRENCY_DEF = 8;
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(60);
    private static final long DAILY_LIMIT_DEF = 1_000L;
    private static final long MONTHLY_LIMIT_DEF = 20_000L;
    private static final String KEY_PREFIX = "orchestrator.providers[%s].";
    private static final String BLANK_NAME_MSG = "orchestrator.providers[].name must not be blank.";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEGATIVE_FMT = "%s must not be negative.";

    private String name;
    private boolean enabled = true;
    private String baseUrl;
    private String apiKey;
    private String model = "";
    private int priority = PRIORITY_DEF;
    private double weight = WEIGHT_DEF;
    private BigDecimal costPerKTokenCents = BigDecimal.ZERO;
    private int maxConcurrency = MAX_CONCURRENCY_DEF;
    private Duration timeout = TIMEOUT_DEF;
    private long dailyLimitCents = DAILY_LIMIT_DEF;
    private long monthlyLimitCents = MONTHLY_LIMIT_DEF;

    /**
     * Validates provider settings.
     */
    public void validateConfiguration() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException(BLANK_NAME_MSG);
        }
        String prefix = String.format(Locale.ROOT, KEY_PREFIX, name);
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException(String.format(Locale.ROOT, BLANK_FMT, prefix + "base-url"));
        }
        if (maxConcurrency < 1) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, prefix + "max-concurrency"));
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, prefix + "timeout"));
        }
        if (weight < 0) {
            throw new IllegalStateException(String.format(Locale.ROOT, NON_NEGATIVE_FMT, prefix + "weight"));
        }
        if (costPerKTokenCents == null || costPerKTokenCents.signum() < 0) {
            throw new IllegalStateException(
                    String.format(Locale.ROOT, NON_NEGATIVE_FMT, prefix + "cost-per-k-token-cents"));
        }
        if (dailyLimitCents < 1) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, prefix + "daily-limit-cents"));
        }
        if (monthlyLimitCents < 1) {
            throw new IllegalStateException(String.format(Locale.ROOT, POSITIVE_FMT, prefix + "monthly-limit-cents"));
        }
    }

    /** Whether an API key has been supplied. */
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    ProviderDescriptor toDescriptor() {
        return new ProviderDescriptor(name, priority, weight, costPerKTokenCents, maxConcurrency, timeout, model);
    }

    BudgetLimits toBudgetLimits() {
        return new BudgetLimits(dailyLimitCents, monthlyLimitCents);
    }

    public String getName() {
        return name;
    }

    public void setName(final String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(final String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model == null ? "" : model;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(final int priority) {
        this.priority = priority;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(final double weight) {
        this.weight = weight;
    }

    public BigDecimal getCostPerKTokenCents() {
        return costPerKTokenCents;
    }

    public void setCostPerKTokenCents(final BigDecimal costPerKTokenCents) {
        this.costPerKTokenCents = costPerKTokenCents;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(final int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(final Duration timeout) {
        this.timeout = timeout;
    }

    public long getDailyLimitCents() {
        return dailyLimitCents;
    }

    public void setDailyLimitCents(final long dailyLimitCents) {
        this.dailyLimitCents = dailyLimitCents;
    }

    public long getMonthlyLimitCents() {
        return monthlyLimitCents;
    }

    public void setMonthlyLimitCents(final long monthlyLimitCents) {
        this.monthlyLimitCents = monthlyLimitCents;
    }
}
