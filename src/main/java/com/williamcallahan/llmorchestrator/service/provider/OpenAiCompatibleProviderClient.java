package com.williamcallahan.llmorchestrator.service.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.http.StreamResponse;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionChunk;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.completions.CompletionUsage;
import com.williamcallahan.llmorchestrator.domain.ProviderDescriptor;
import com.williamcallahan.llmorchestrator.service.cost.CostEstimator;
import com.williamcallahan.llmorchestrator.support.BaseUrlNormalizer;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * {@link ProviderClient} for any endpoint speaking the OpenAI chat-completions protocol.
 *
 * <p>OpenAI itself, Anthropic and Gemini through their OpenAI-compatible endpoints, and local
 * Ollama servers are all served by this adapter with different base URLs and models.</p>
 */
public class OpenAiCompatibleProviderClient implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleProviderClient.class);

    private final ProviderDescriptor descriptor;
    private final OpenAIClient client;
    private final CostEstimator costEstimator;

    /**
     * Creates an adapter with its own HTTP client.
     *
     * @param descriptor provider configuration
     * @param baseUrl OpenAI-compatible base URL
     * @param apiKey API key, may be a placeholder for local servers
     * @param costEstimator token-to-cents conversion
     * @return configured adapter
     */
    public static OpenAiCompatibleProviderClient create(
            ProviderDescriptor descriptor, String baseUrl, String apiKey, CostEstimator costEstimator) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("API key is not configured for provider " + descriptor.name());
        }
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(BaseUrlNormalizer.normalize(baseUrl))
                .timeout(descriptor.timeout())
                .maxRetries(0)
                .build();
        log.info("Initialized provider client (provider={}, baseUrl={})", descriptor.name(), baseUrl);
        return new OpenAiCompatibleProviderClient(descriptor, client, costEstimator);
    }

    OpenAiCompatibleProviderClient(ProviderDescriptor descriptor, OpenAIClient client, CostEstimator costEstimator) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.client = Objects.requireNonNull(client, "client");
        this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator");
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public ProviderResult send(ModelRequest request) {
        ChatCompletionCreateParams params = buildChatParams(request);
        try {
            ChatCompletion completion = client.chat().completions().create(params);
            String text = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElse("");
            Optional<CompletionUsage> usage = completion.usage();
            long promptTokens = usage.map(CompletionUsage::promptTokens).orElse(ModelResponse.UNREPORTED);
            long completionTokens = usage.map(CompletionUsage::completionTokens).orElse(ModelResponse.UNREPORTED);
            return ProviderResult.success(new ModelResponse(text, completion.model(), promptTokens, completionTokens));
        } catch (RuntimeException failure) {
            ProviderErrorCategory category = OpenAiFailureClassifier.classify(failure);
            log.warn(
                    "Provider call failed (provider={}, category={}, exceptionType={})",
                    descriptor.name(),
                    category,
                    failure.getClass().getSimpleName());
            return ProviderResult.failure(category, failure.getClass().getSimpleName());
        }
    }

    @Override
    public Flux<String> stream(ModelRequest request) {
        return Flux.<String>create(sink -> {
                    ChatCompletionCreateParams params = buildChatParams(request);
                    try (StreamResponse<ChatCompletionChunk> streamResponse =
                            client.chat().completions().createStreaming(params)) {
                        sink.onDispose(streamResponse::close);
                        Iterator<ChatCompletionChunk> chunks = streamResponse.stream().iterator();
                        while (chunks.hasNext() && !sink.isCancelled()) {
                            chunks.next().choices().forEach(choice -> choice.delta().content()
                                    .filter(content -> !content.isEmpty())
                                    .ifPresent(sink::next));
                        }
                        sink.complete();
                    } catch (RuntimeException failure) {
                        if (sink.isCancelled()) {
                            return;
                        }
                        ProviderErrorCategory category = OpenAiFailureClassifier.classify(failure);
                        sink.error(new ProviderCallException(
                                descriptor.name(), category, failure.getClass().getSimpleName(), failure));
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public long estimateCostCents(ModelRequest request) {
        return costEstimator.estimateCents(descriptor, request);
    }

    @Override
    public long actualCostCents(ModelRequest request, ModelResponse response) {
        return costEstimator.actualCents(descriptor, request, response);
    }

    @Override
    public long streamedCostCents(ModelRequest request, String deliveredText) {
        return costEstimator.streamedCents(descriptor, request, deliveredText);
    }

    private ChatCompletionCreateParams buildChatParams(ModelRequest request) {
        String model = request.model().isBlank() ? descriptor.defaultModel() : request.model();
        return ChatCompletionCreateParams.builder()
                .addUserMessage(request.prompt())
                .model(model)
                .temperature(request.temperature())
                .maxCompletionTokens(request.maxOutputTokens())
                .build();
    }
}
