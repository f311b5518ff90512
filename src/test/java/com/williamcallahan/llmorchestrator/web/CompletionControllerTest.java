package com.williamcallahan.llmorchestrator.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.llmorchestrator.domain.SynthesisStrategy;
import com.williamcallahan.llmorchestrator.domain.errors.ApiCompletionResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiErrorResponse;
import com.williamcallahan.llmorchestrator.domain.errors.ApiResponse;
import com.williamcallahan.llmorchestrator.service.provider.ProviderErrorCategory;
import com.williamcallahan.llmorchestrator.service.ratelimit.RateLimitScope;
import com.williamcallahan.llmorchestrator.support.OrchestratorFixture;
import com.williamcallahan.llmorchestrator.support.ScriptedProviderClient;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Verifies completion endpoint responses over a scripted orchestrator.
 */
class CompletionControllerTest {
    private static final String PROMPT = "Name three JVM garbage collectors.";
    private static final Duration BLOCK_TIMEOUT = Duration.ofSeconds(5);

    @Test
    void complete_returnsCompletionPayload() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                ScriptedProviderClient.named("openai").defaultText("G1, ZGC, Shenandoah")).build()) {
            CompletionController controller = controller(fixture);

            ResponseEntity<ApiResponse> response = controller.complete(body(PROMPT), httpRequest("10.0.0.1"))
                    .block(BLOCK_TIMEOUT);

            assertNotNull(response);
            assertEquals(HttpStatus.OK, response.getStatusCode());
            ApiCompletionResponse payload = assertInstanceOf(ApiCompletionResponse.class, response.getBody());
            assertEquals("G1, ZGC, Shenandoah", payload.text());
            assertEquals("openai", payload.provider());
        }
    }

    @Test
    void complete_mapsRateLimitToTooManyRequestsUsingForwardedAddress() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(ScriptedProviderClient.named("openai"))
                .rateLimit(RateLimitScope.IP, 1, 0.5)
                .build()) {
            CompletionController controller = controller(fixture);
            MockHttpServletRequest proxied = httpRequest("10.0.0.1");
            proxied.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");

            controller.complete(body(PROMPT), proxied).block(BLOCK_TIMEOUT);
            ResponseEntity<ApiResponse> limited = controller.complete(body("another prompt"), proxied)
                    .block(BLOCK_TIMEOUT);

            assertNotNull(limited);
            assertEquals(HttpStatus.TOO_MANY_REQUESTS, limited.getStatusCode());
            assertEquals("2", limited.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            ApiErrorResponse error = assertInstanceOf(ApiErrorResponse.class, limited.getBody());
            assertEquals("RATE_LIMITED", error.code());
        }
    }

    @Test
    void complete_mapsFatalProviderErrorToBadRequest() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                ScriptedProviderClient.named("openai").failNext(ProviderErrorCategory.INVALID_REQUEST)).build()) {

            ResponseEntity<ApiResponse> response = controller(fixture)
                    .complete(body(PROMPT), httpRequest("10.0.0.1"))
                    .block(BLOCK_TIMEOUT);

            assertNotNull(response);
            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        }
    }

    @Test
    void synthesize_returnsChosenAnswer() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                ScriptedProviderClient.named("openai").priority(1).defaultText("ZGC"),
                ScriptedProviderClient.named("groq").priority(2).defaultText("ZGC")).build()) {

            ResponseEntity<ApiResponse> response = controller(fixture)
                    .synthesize(body(PROMPT), SynthesisStrategy.MAJORITY_VOTE, 2, httpRequest("10.0.0.1"))
                    .block(BLOCK_TIMEOUT);

            assertNotNull(response);
            assertEquals(HttpStatus.OK, response.getStatusCode());
            ApiCompletionResponse payload = assertInstanceOf(ApiCompletionResponse.class, response.getBody());
            assertEquals("ZGC", payload.text());
            assertEquals("openai", payload.provider());
        }
    }

    @Test
    void synthesize_rejectsSingleProviderLimit() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(ScriptedProviderClient.named("openai")).build()) {

            ResponseEntity<ApiResponse> response = controller(fixture)
                    .synthesize(body(PROMPT), SynthesisStrategy.FIRST_VALID, 1, httpRequest("10.0.0.1"))
                    .block(BLOCK_TIMEOUT);

            assertNotNull(response);
            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        }
    }

    @Test
    void stream_emitsTextEventsThenDoneAndDisablesProxyBuffering() {
        try (OrchestratorFixture fixture = OrchestratorFixture.with(
                ScriptedProviderClient.named("openai").streamNext("Hello", " world")).build()) {
            MockHttpServletResponse httpResponse = new MockHttpServletResponse();

            List<ServerSentEvent<String>> events = controller(fixture)
                    .stream(body(PROMPT), httpRequest("10.0.0.1"), httpResponse)
                    .collectList()
                    .block(BLOCK_TIMEOUT);

            assertNotNull(events);
            assertEquals(List.of(SseConstants.EVENT_TEXT, SseConstants.EVENT_TEXT, SseConstants.EVENT_DONE),
                    events.stream().map(ServerSentEvent::event).toList());
            assertEquals("no", httpResponse.getHeader("X-Accel-Buffering"));
        }
    }

    private static CompletionController controller(OrchestratorFixture fixture) {
        return new CompletionController(
                fixture.orchestrator, new SseSupport(new ObjectMapper()), fixture.clock, new ExceptionResponseBuilder());
    }

    private static CompletionRequestBody body(String prompt) {
        return new CompletionRequestBody(prompt, null, 0.0, 128, null, null, null, 10_000L, null);
    }

    private static MockHttpServletRequest httpRequest(String remoteAddress) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddress);
        return request;
    }
}
