package dev.visibility.llm;

import dev.visibility.config.LlmProperties;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.retry.ProcessingError;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Shared caching, metrics and fan-out for gateway implementations.
 */
@Slf4j
public abstract class AbstractLlmGatewayClient implements LlmGatewayClient {

    protected final LlmProperties properties;
    protected final ResponseCache cache;
    protected final VisibilityMetrics metrics;

    protected AbstractLlmGatewayClient(LlmProperties properties, ResponseCache cache, VisibilityMetrics metrics) {
        this.properties = properties;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Perform the backend call for one prompt. Errors should be {@link LlmGatewayException}s.
     */
    protected abstract Mono<LlmResponse> execute(String model, String prompt, QueryOptions options);

    @Override
    public Mono<LlmResponse> query(String model, String prompt, QueryOptions options) {
        QueryOptions effective = options != null ? options : QueryOptions.defaults();
        boolean cacheEnabled = properties.getCache().isEnabled();
        String key = cacheEnabled ? ResponseCache.keyFor(model, prompt) : null;

        if (cacheEnabled) {
            Optional<LlmResponse> hit = cache.get(key);
            if (hit.isPresent()) {
                log.debug("Cache hit for model {}", model);
                metrics.recordCacheHit();
                return Mono.just(hit.get().asCached());
            }
        }

        long start = System.currentTimeMillis();
        return Mono.defer(() -> execute(model, prompt, effective))
                .map(response -> response.withProcessingTime(System.currentTimeMillis() - start))
                .doOnNext(response -> {
                    metrics.recordLlmQuery(model, response.processingTimeMs());
                    if (cacheEnabled) {
                        cache.put(key, response);
                    }
                })
                .doOnError(e -> metrics.recordLlmError(model, errorKind(e)));
    }

    @Override
    public Mono<List<QueryOutcome>> queryParallel(List<LlmQuery> queries) {
        if (queries == null || queries.isEmpty()) {
            return Mono.just(List.of());
        }

        int configured = properties.getParallelism().getMaxInFlight();
        int concurrency = configured > 0 ? configured : queries.size();
        log.info("Dispatching {} LLM queries (max {} in flight)", queries.size(), concurrency);

        return Flux.range(0, queries.size())
                .flatMap(index -> {
                    LlmQuery query = queries.get(index);
                    return Mono.defer(() -> query(query))
                            .map(response -> new Indexed(index, QueryOutcome.success(query, response)))
                            .onErrorResume(e -> {
                                log.warn("Query {} to {} failed: {}", index, query.model(), ErrorSanitizer.sanitize(e));
                                return Mono.just(new Indexed(index, QueryOutcome.failure(query, e)));
                            });
                }, concurrency)
                .collectList()
                .map(settled -> align(queries, settled));
    }

    private List<QueryOutcome> align(List<LlmQuery> queries, List<Indexed> settled) {
        QueryOutcome[] ordered = new QueryOutcome[queries.size()];
        for (Indexed item : settled) {
            ordered[item.index()] = item.outcome();
        }
        for (int i = 0; i < ordered.length; i++) {
            if (ordered[i] == null) {
                ordered[i] = QueryOutcome.failure(queries.get(i),
                        LlmGatewayException.invalidResponse(queries.get(i).model(), "no response received"));
            }
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    protected double temperature(QueryOptions options) {
        return options.temperature() != null ? options.temperature() : properties.getTemperature();
    }

    protected int maxTokens(QueryOptions options) {
        return options.maxTokens() != null ? options.maxTokens() : properties.getMaxTokens();
    }

    private String errorKind(Throwable e) {
        if (e instanceof LlmGatewayException) {
            return ((LlmGatewayException) e).getKind().name();
        }
        if (e instanceof ProcessingError) {
            return ((ProcessingError) e).getCode();
        }
        return LlmErrorKind.UNKNOWN.name();
    }

    private record Indexed(int index, QueryOutcome outcome) {
    }
}
