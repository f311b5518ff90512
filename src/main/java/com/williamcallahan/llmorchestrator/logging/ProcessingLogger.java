package com.williamcallahan.llmorchestrator.logging;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitDecision;
import java.util.List;
import java.util.Optional;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs each orchestration step on the {@code PIPELINE} logger with its duration.
 *
 * <p>Only request ids, counts and outcomes are logged; prompt text never is.</p>
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final String NO_REQUEST = "-";

    // Request id of the blocking execution running on this thread
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() -> NO_REQUEST);

    /**
     * Log the whole blocking execution.
     */
    @Around("execution(* com.williamcallahan.llmorchestrator.service.CompletionOrchestrator.execute(..)) && args(request)")
    public Object logExecution(ProceedingJoinPoint joinPoint, CompletionRequest request) throws Throwable {
        String previous = REQUEST_ID.get();
        String requestId = request.id().toString();
        REQUEST_ID.set(requestId);
        long startTime = System.currentTimeMillis();
        PIPELINE_LOG.info("[{}] ORCHESTRATION - Starting (promptLength={}, maxCostCents={})",
                requestId, request.prompt().length(), request.maxCostCents());
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            if (result instanceof OrchestrationResult outcome) {
                PIPELINE_LOG.info("[{}] ORCHESTRATION - {} in {}ms", requestId, describe(outcome), duration);
            }
            return result;
        } catch (RuntimeException e) {
            PIPELINE_LOG.error("[{}] ORCHESTRATION - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            if (NO_REQUEST.equals(previous)) {
                REQUEST_ID.remove();
            } else {
                REQUEST_ID.set(previous);
            }
        }
    }

    /**
     * Log stream creation; the stream itself runs later on the subscriber's thread.
     */
    @Around("execution(* com.williamcallahan.llmorchestrator.service.CompletionOrchestrator.executeStreaming(..)) && args(request)")
    public Object logStreamCreation(ProceedingJoinPoint joinPoint, CompletionRequest request) throws Throwable {
        PIPELINE_LOG.info("[{}] STREAM - Created (promptLength={})", request.id(), request.prompt().length());
        return joinPoint.proceed();
    }

    /**
     * Log the caller rate-limit gate.
     */
    @Around("execution(* com.williamcallahan.llmorchestrator.service.ratelimit.TokenBucketRateLimiter.allowAll(..))")
    public Object logRateLimitGate(ProceedingJoinPoint joinPoint) throws Throwable {
        Object result = joinPoint.proceed();
        if (result instanceof RateLimitDecision decision && !decision.allowed()) {
            PIPELINE_LOG.info("[{}] STEP 1: RATE LIMIT - Denied by {} (retryAfter={}ms)",
                    REQUEST_ID.get(), decision.scopeKey(), decision.retryAfter().toMillis());
        } else {
            PIPELINE_LOG.debug("[{}] STEP 1: RATE LIMIT - Allowed", REQUEST_ID.get());
        }
        return result;
    }

    /**
     * Log the response cache lookup.
     */
    @Around("execution(* com.williamcallahan.llmorchestrator.service.cache.ResponseCache.get(..))")
    public Object logCacheLookup(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.currentTimeMillis();
        Object result = joinPoint.proceed();
        boolean hit = result instanceof Optional<?> cached && cached.isPresent();
        PIPELINE_LOG.info("[{}] STEP 2: CACHE LOOKUP - {} in {}ms",
                REQUEST_ID.get(), hit ? "Hit" : "Miss", System.currentTimeMillis() - startTime);
        return result;
    }

    /**
     * Log candidate ranking.
     */
    @Around("execution(* com.williamcallahan.llmorchestrator.service.routing.ProviderRouter.candidateProviders(..))")
    public Object logRouting(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.currentTimeMillis();
        Object result = joinPoint.proceed();
        if (result instanceof List<?> candidates) {
            PIPELINE_LOG.info("[{}] STEP 3: ROUTING - {} eligible candidates in {}ms",
                    REQUEST_ID.get(), candidates.size(), System.currentTimeMillis() - startTime);
        }
        return result;
    }

    private static String describe(OrchestrationResult outcome) {
        return outcome.response()
                .map(response -> "Completed by " + response.provider()
                        + (response.cacheHit() ? " (cached)" : "") + ", costCents=" + response.costCents())
                .orElseGet(() -> "Rejected with " + outcome.error().map(error -> error.code().name()).orElse("unknown"));
    }
}
