package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import com.williamcallahan.llmorchestrator.service.CompletionOrchestrator;
import com.williamcallahan.llmorchestrator.service.cache.ResponseCache;
import com.williamcallahan.llmorchestrator.service.circuit.CircuitBreakerRegistry;
import com.williamcallahan.llmorchestrator.service.history.AttemptRecord;
import com.williamcallahan.llmorchestrator.service.cost.CostLedger;
import com.williamcallahan.llmorchestrator.service.provider.ProviderClientRegistry;
import com.williamcallahan.llmorchestrator.service.ratelimit.TokenBucketRateLimiter;
import com.williamcallahan.llmorchestrator.service.telemetry.AsyncUsageRecorder;
import java.time.Duration;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints: diagnostics snapshot, recent provider attempts and the manual breaker reset.
 */
@RestController
@RequestMapping("/api/orchestrator")
public class OrchestratorStatusController extends BaseController {
    private final ProviderClientRegistry providers;
    private final CircuitBreakerRegistry breakers;
    private final CostLedger costLedger;
    private final ResponseCache responseCache;
    private final TokenBucketRateLimiter rateLimiter;
    private final CompletionOrchestrator orchestrator;
    private final AsyncUsageRecorder usageRecorder;

    public OrchestratorStatusController(
            ProviderClientRegistry providers,
            CircuitBreakerRegistry breakers,
            CostLedger costLedger,
            ResponseCache responseCache,
            TokenBucketRateLimiter rateLimiter,
            CompletionOrchestrator orchestrator,
            AsyncUsageRecorder usageRecorder,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.providers = providers;
        this.breakers = breakers;
        this.costLedger = costLedger;
        this.responseCache = responseCache;
        this.rateLimiter = rateLimiter;
        this.orchestrator = orchestrator;
        this.usageRecorder = usageRecorder;
    }

    @GetMapping("/status")
    public OrchestratorStatusResponse status() {
        return new OrchestratorStatusResponse(
                providers.names(),
                breakers.snapshots(),
                costLedger.snapshots(),
                responseCache.stats(),
                rateLimiter.bucketCount(),
                orchestrator.coalescedWaiters(),
                costLedger.unbilledOverrunCents(),
                usageRecorder.writtenRecords(),
                usageRecorder.droppedRecords());
    }

    /**
     * Provider attempts of the last {@code minutes}, oldest first.
     */
    @GetMapping("/attempts")
    public ResponseEntity<?> recentAttempts(@RequestParam(name = "minutes", defaultValue = "1440") long minutes) {
        if (minutes < 1) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "minutes must be positive");
        }
        List<AttemptRecord> attempts = orchestrator.recentAttempts(Duration.ofMinutes(minutes));
        return ResponseEntity.ok(attempts);
    }

    /**
     * Forces a provider's breaker closed; the only manual override of breaker state.
     */
    @PostMapping("/circuits/{provider}/close")
    public ResponseEntity<ApiResponse> closeCircuit(@PathVariable("provider") String provider) {
        if (!breakers.forceClose(provider)) {
            return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Unknown provider: " + provider);
        }
        return exceptionBuilder.buildSuccessResponse("Circuit closed for " + provider);
    }
}
