package com.williamcallahan.llmorchestrator.web;

import com.williamcallahan.llmorchestrator.domain.CompletionRequest;
import com.williamcallahan.llmorchestrator.domain.OrchestrationResult;
import com.williamcallahan.llmorchestrator.domain.SynthesisStrategy;
import com.williamcallahan.llmorchestrator.domain.errors.ApiCompletionResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import com.williamcallahan.llmorchestrator.service.CompletionOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Completion endpoints: one JSON response, or a token stream over SSE.
 */
@RestController
@RequestMapping("/api/completions")
public class CompletionController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(CompletionController.class);

    private final CompletionOrchestrator orchestrator;
    private final SseSupport sseSupport;
    private final Clock clock;

    public CompletionController(
            CompletionOrchestrator orchestrator,
            SseSupport sseSupport,
            Clock clock,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.orchestrator = orchestrator;
        this.sseSupport = sseSupport;
        this.clock = clock;
    }

    /**
     * Serves one completion.
     *
     * @return 200 with the completion, or the mapped error status
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse>> complete(
            @Valid @RequestBody CompletionRequestBody body, HttpServletRequest httpRequest) {
        CompletionRequest request = body.toCompletionRequest(clientAddress(httpRequest), false, clock);
        log.debug("Completion request received (requestId={}, promptHash={})", request.id(), request.promptHash());
        return orchestrator.executeAsync(request).map(this::toResponseEntity);
    }

    /**
     * Asks several providers and returns one answer chosen by {@code strategy}.
     */
    @PostMapping(value = "/synthesize", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse>> synthesize(
            @Valid @RequestBody CompletionRequestBody body,
            @RequestParam(name = "strategy", defaultValue = "MAJORITY_VOTE") SynthesisStrategy strategy,
            @RequestParam(name = "maxProviders", defaultValue = "3") int maxProviders,
            HttpServletRequest httpRequest) {
        if (maxProviders < 2) {
            return Mono.just(exceptionBuilder.buildErrorResponse(
                    HttpStatus.BAD_REQUEST, "maxProviders must be at least 2"));
        }
        CompletionRequest request = body.toCompletionRequest(clientAddress(httpRequest), false, clock);
        log.debug("Synthesis request received (requestId={}, strategy={})", request.id(), strategy);
        return orchestrator.synthesizeAsync(request, strategy, maxProviders).map(this::toResponseEntity);
    }

    /**
     * Streams a completion. Text arrives as {@code text} events, fallbacks as {@code status},
     * and the stream ends with {@code done} or {@code error}.
     */
    @PostMapping(value = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(
            @Valid @RequestBody CompletionRequestBody body,
            HttpServletRequest httpRequest,
            HttpServletResponse httpResponse) {
        sseSupport.configureStreamingHeaders(httpResponse);
        CompletionRequest request = body.toCompletionRequest(clientAddress(httpRequest), true, clock);
        log.debug("Streaming request received (requestId={}, promptHash={})", request.id(), request.promptHash());
        return sseSupport.toServerSentEvents(orchestrator.executeStreaming(request).events());
    }

    private ResponseEntity<ApiResponse> toResponseEntity(OrchestrationResult result) {
        if (result instanceof OrchestrationResult.Completed completed) {
            return ResponseEntity.ok(ApiCompletionResponse.from(completed.value()));
        }
        return exceptionBuilder.buildErrorResponse(((OrchestrationResult.Rejected) result).value());
    }
}
