package com.williamcallahan.llmorchestrator.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.ratelimit.BucketPolicy;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies orchestrator property validation and conversion into runtime settings.
 */
class OrchestratorPropertiesTest {
    private static final String OPENAI_URL = "https://api.openai.com/v1";

    @Test
    void acceptsDefaultsWithOneProvider() {
        OrchestratorProperties properties = withProviders(provider("openai"));

        assertDoesNotThrow(properties::validateConfiguration);
    }

    @Test
    void rejectsEmptyProviderList() {
        OrchestratorProperties properties = new OrchestratorProperties();

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsDuplicateProviderNames() {
        OrchestratorProperties properties = withProviders(provider("openai"), provider("openai"));

        IllegalStateException failure = assertThrows(IllegalStateException.class, properties::validateConfiguration);
        assertEquals("Duplicate provider name: openai", failure.getMessage());
    }

    @Test
    void rejectsProviderWithoutBaseUrl() {
        ProviderConfig provider = provider("ollama");
        provider.setBaseUrl(" ");

        IllegalStateException failure =
                assertThrows(IllegalStateException.class, withProviders(provider)::validateConfiguration);
        assertTrue(failure.getMessage().contains("orchestrator.providers[ollama].base-url"));
    }

    @Test
    void rejectsNegativeProviderCost() {
        ProviderConfig provider = provider("openai");
        provider.setCostPerKTokenCents(new BigDecimal("-0.1"));

        assertThrows(IllegalStateException.class, withProviders(provider)::validateConfiguration);
    }

    @Test
    void rejectsWarningThresholdOutsideUnitInterval() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getBudget().setWarningThreshold(1.5);

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsBudgetPressureOutsideUnitIntervalAndMissingStrategy() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getRouting().setBudgetPressureHeadroom(0);

        IllegalStateException failure = assertThrows(IllegalStateException.class, properties::validateConfiguration);
        assertTrue(failure.getMessage().contains("orchestrator.routing.budget-pressure-headroom"));

        properties.getRouting().setBudgetPressureHeadroom(0.2);
        properties.getRouting().setStrategy(null);
        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveHistoryCapacity() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getHistory().setCapacity(0);

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsUnknownBudgetZone() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getBudget().setZoneId("Mars/Olympus");

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsMaxCoolDownBelowCoolDown() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getCircuit().setMaxCoolDown(Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveRateLimitRefill() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getRateLimit().getUser().setRefillPerSecond(0);

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCoalescingWindow() {
        OrchestratorProperties properties = withProviders(provider("openai"));
        properties.getCoalescing().setWindow(Duration.ofMillis(-1));

        assertThrows(IllegalStateException.class, properties::validateConfiguration);
    }

    @Test
    void providerConfig_convertsToDescriptorAndLimits() {
        ProviderConfig provider = provider("anthropic");
        provider.setPriority(2);
        provider.setModel("claude-3-5-haiku-latest");
        provider.setCostPerKTokenCents(new BigDecimal("0.8"));
        provider.setDailyLimitCents(500);

        ProviderDescriptor descriptor = provider.toDescriptor();

        assertEquals("anthropic", descriptor.name());
        assertEquals(2, descriptor.priority());
        assertEquals("claude-3-5-haiku-latest", descriptor.defaultModel());
        assertEquals(500, provider.toBudgetLimits().dailyLimitCents());
        assertFalse(provider.hasApiKey());
    }

    @Test
    void rateLimitConfig_exposesOnePolicyPerScope() {
        Map<RateLimitScope, BucketPolicy> policies = new RateLimitConfig().policies();

        assertEquals(RateLimitScope.values().length, policies.size());
        assertEquals(20, policies.get(RateLimitScope.IP).capacity());
    }

    private static OrchestratorProperties withProviders(ProviderConfig... providers) {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setProviders(List.of(providers));
        return properties;
    }

    private static ProviderConfig provider(String name) {
        ProviderConfig provider = new ProviderConfig();
        provider.setName(name);
        provider.setBaseUrl(OPENAI_URL);
        return provider;
    }
}
