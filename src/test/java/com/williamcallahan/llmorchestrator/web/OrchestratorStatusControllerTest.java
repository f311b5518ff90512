package com.williamcallahan.llmorchestrator.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.williamcallahan.llmorchestrator.domain.errors.ApiErrorResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import com.williamcallahan.llmorchestrator.service.circuit.CallPermission;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitState;
import com.williamcallahan.llmorchestrator.service.history.AttemptRecord;
import com.williamcallahan.llmorchestrator.service.provider.ProviderErrorCategory;
import com.williamcallahan.llmorchestrator.service.telemetry.AsyncUsageRecorder;
import com.williamcallahan.llmorchestrator.support.OrchestratorFixture;
import com.williamcallahan.llmorchestrator.support.ScriptedProviderClient;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies the diagnostics snapshot and the manual breaker reset endpoint.
 */
class OrchestratorStatusControllerTest {

    @Test
    void status_reportsProvidersCircuitsAndCacheCounters() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                        ScriptedProviderClient.named("openai").priority(1),
                        ScriptedProviderClient.named("groq").priority(2))
                .build();
                AsyncUsageRecorder recorder = recorder(fixture)) {
            fixture.orchestrator.execute(fixture.request("What is a safepoint?"));
            fixture.orchestrator.execute(fixture.request("What is a safepoint?"));

            OrchestratorStatusResponse status = controller(fixture, recorder).status();

            assertEquals(List.of("openai", "groq"), status.providers());
            assertEquals(2, status.circuits().size());
            assertEquals(1, status.cache().hits());
            assertEquals(0, status.usageRecordsDropped());
        }
    }

    @Test
    void recentAttempts_listsFallbackAttemptsInsideWindow() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                        ScriptedProviderClient.named("openai").priority(1).failNext(ProviderErrorCategory.SERVER_ERROR),
                        ScriptedProviderClient.named("groq").priority(2))
                .build();
                AsyncUsageRecorder recorder = recorder(fixture)) {
            fixture.orchestrator.execute(fixture.request("What is a safepoint?"));

            ResponseEntity<?> response = controller(fixture, recorder).recentAttempts(60);

            assertEquals(HttpStatus.OK, response.getStatusCode());
            List<?> attempts = assertInstanceOf(List.class, response.getBody());
            assertNotNull(attempts);
            assertEquals(List.of(AttemptRecord.Status.FAILED, AttemptRecord.Status.SUCCEEDED), attempts.stream()
                    .map(attempt -> ((AttemptRecord) attempt).status())
                    .toList());
            assertEquals(HttpStatus.BAD_REQUEST, controller(fixture, recorder).recentAttempts(0).getStatusCode());
        }
    }

    @Test
    void closeCircuit_resetsOpenBreaker() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(ScriptedProviderClient.named("openai"))
                        .failureThreshold(1)
                        .build();
                AsyncUsageRecorder recorder = recorder(fixture)) {
            fixture.breakers.forProvider("openai").recordFailure(CallPermission.GRANTED);

            ResponseEntity<ApiResponse> response = controller(fixture, recorder).closeCircuit("openai");

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals(CircuitState.CLOSED, fixture.breakers.forProvider("openai").state());
        }
    }

    @Test
    void closeCircuit_returnsNotFoundForUnknownProvider() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(ScriptedProviderClient.named("openai")).build();
                AsyncUsageRecorder recorder = recorder(fixture)) {

            ResponseEntity<ApiResponse> response = controller(fixture, recorder).closeCircuit("mistral");

            assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
            assertEquals("Unknown provider: mistral",
                    assertInstanceOf(ApiErrorResponse.class, response.getBody()).message());
        }
    }

    private static AsyncUsageRecorder recorder(OrchestratorFixture fixture) {
        return new AsyncUsageRecorder(16, batch -> {}, fixture.metrics);
    }

    private static OrchestratorStatusController controller(OrchestratorFixture fixture, AsyncUsageRecorder recorder) {
        return new OrchestratorStatusController(
                fixture.registry,
                fixture.breakers,
                fixture.ledger,
                fixture.cache,
                fixture.rateLimiter,
                fixture.orchestrator,
                recorder,
                new ExceptionResponseBuilder());
    }
}
