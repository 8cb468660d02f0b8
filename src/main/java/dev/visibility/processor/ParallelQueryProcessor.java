package dev.visibility.processor;

import dev.visibility.analysis.QueryResult;
import dev.visibility.analysis.ResponseAnalyzer;
import dev.visibility.analysis.Sentiment;
import dev.visibility.config.LlmProperties;
import dev.visibility.llm.LlmGatewayClient;
import dev.visibility.llm.LlmQuery;
import dev.visibility.llm.QueryOutcome;
import dev.visibility.processor.ProcessingStats.ModelPerformance;
import dev.visibility.retry.ErrorSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fans queries out to the gateway and runs every reply through the analyzer.
 * Always returns one result per query, in input order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParallelQueryProcessor {

    private final LlmGatewayClient gatewayClient;
    private final ResponseAnalyzer responseAnalyzer;
    private final LlmProperties llmProperties;

    /**
     * Process a batch of queries for one business.
     *
     * @return exactly {@code queries.size()} results, index-aligned with the input
     */
    public Mono<List<QueryResult>> processQueries(List<LlmQuery> queries, String businessName) {
        if (queries == null || queries.isEmpty()) {
            return Mono.just(List.of());
        }

        long start = System.currentTimeMillis();
        List<List<Integer>> batches = createOptimizedBatches(queries);
        log.info("Processing {} queries for '{}' in {} batch(es)", queries.size(), businessName, batches.size());

        return processBatches(queries, batches, businessName)
                .map(results -> {
                    long successful = results.stream().filter(QueryResult::isSuccess).count();
                    log.info("Processed {} queries ({} successful) in {}ms",
                            results.size(), successful, System.currentTimeMillis() - start);
                    return results;
                })
                .onErrorResume(e -> {
                    log.error("Query processing failed for '{}': {}", businessName, ErrorSanitizer.sanitize(e));
                    return Mono.just(fallbackResults(queries, "Query processing failed: " + ErrorSanitizer.sanitize(e)));
                });
    }

    /**
     * Group query indexes by model, then chunk each group to the configured batch size.
     */
    List<List<Integer>> createOptimizedBatches(List<LlmQuery> queries) {
        int batchSize = Math.max(1, llmProperties.getParallelism().getBatchSize());
        if (queries.size() <= batchSize) {
            List<Integer> all = new ArrayList<>();
            for (int i = 0; i < queries.size(); i++) {
                all.add(i);
            }
            return List.of(all);
        }

        Map<String, List<Integer>> byModel = new LinkedHashMap<>();
        for (int i = 0; i < queries.size(); i++) {
            byModel.computeIfAbsent(queries.get(i).model(), m -> new ArrayList<>()).add(i);
        }

        List<List<Integer>> batches = new ArrayList<>();
        for (List<Integer> indexes : byModel.values()) {
            for (int i = 0; i < indexes.size(); i += batchSize) {
                batches.add(indexes.subList(i, Math.min(i + batchSize, indexes.size())));
            }
        }
        return batches;
    }

    private Mono<List<QueryResult>> processBatches(List<LlmQuery> queries, List<List<Integer>> batches,
                                                   String businessName) {
        int wavesOf = Math.max(1, llmProperties.getParallelism().getMaxConcurrency());
        Duration pause = llmProperties.getParallelism().getPauseBetweenBatches();
        List<List<List<Integer>>> waves = partition(batches, wavesOf);
        QueryResult[] results = new QueryResult[queries.size()];

        return Flux.range(0, waves.size())
                .concatMap(w -> {
                    Mono<Void> wave = Flux.fromIterable(waves.get(w))
                            .flatMap(batch -> processBatch(queries, batch, businessName, results))
                            .then();
                    return w == 0 || pause.isZero() ? wave : Mono.delay(pause).then(wave);
                })
                .then(Mono.fromCallable(() -> collect(queries, results)));
    }

    private Mono<Void> processBatch(List<LlmQuery> queries, List<Integer> batch, String businessName,
                                    QueryResult[] results) {
        List<LlmQuery> batchQueries = batch.stream().map(queries::get).toList();
        return gatewayClient.queryParallel(batchQueries)
                .doOnNext(outcomes -> {
                    for (int i = 0; i < batch.size(); i++) {
                        QueryOutcome outcome = i < outcomes.size() ? outcomes.get(i) : null;
                        results[batch.get(i)] = toResult(batchQueries.get(i), outcome, businessName);
                    }
                })
                .onErrorResume(e -> {
                    String message = "Query processing failed: " + ErrorSanitizer.sanitize(e);
                    log.warn("Batch of {} queries failed: {}", batch.size(), message);
                    for (Integer index : batch) {
                        results[index] = QueryResult.failed(queries.get(index), message);
                    }
                    return Mono.empty();
                })
                .then();
    }

    private QueryResult toResult(LlmQuery query, QueryOutcome outcome, String businessName) {
        if (outcome == null) {
            return QueryResult.failed(query, "No response received");
        }
        if (!outcome.isSuccess()) {
            return QueryResult.failed(query, ErrorSanitizer.sanitize(outcome.error()));
        }
        return responseAnalyzer.analyze(outcome.response(), businessName, query.promptType())
                .withPrompt(query.prompt());
    }

    private List<QueryResult> collect(List<LlmQuery> queries, QueryResult[] results) {
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                results[i] = QueryResult.failed(queries.get(i), "No response received");
            }
        }
        return new ArrayList<>(Arrays.asList(results));
    }

    private List<QueryResult> fallbackResults(List<LlmQuery> queries, String error) {
        return queries.stream().map(q -> QueryResult.failed(q, error)).toList();
    }

    /**
     * Derived statistics for logging and metrics; not used by aggregation.
     */
    public ProcessingStats statistics(List<QueryResult> results) {
        int total = results.size();
        List<QueryResult> successful = results.stream().filter(QueryResult::isSuccess).toList();
        long mentioned = results.stream().filter(QueryResult::mentioned).count();
        double mentionRate = total == 0 ? 0.0 : (double) mentioned / total;
        double avgConfidence = successful.stream().mapToDouble(QueryResult::confidence).average().orElse(0.0);

        Map<Sentiment, Long> distribution = new EnumMap<>(Sentiment.class);
        for (Sentiment sentiment : Sentiment.values()) {
            distribution.put(sentiment, 0L);
        }
        successful.forEach(r -> distribution.merge(r.sentiment(), 1L, Long::sum));

        Map<String, List<QueryResult>> byModel = new LinkedHashMap<>();
        results.forEach(r -> byModel.computeIfAbsent(r.model(), m -> new ArrayList<>()).add(r));
        Map<String, ModelPerformance> performance = new LinkedHashMap<>();
        byModel.forEach((model, modelResults) -> {
            int errors = (int) modelResults.stream().filter(r -> !r.isSuccess()).count();
            int mentions = (int) modelResults.stream().filter(QueryResult::mentioned).count();
            double confidence = modelResults.stream().filter(QueryResult::isSuccess)
                    .mapToDouble(QueryResult::confidence).average().orElse(0.0);
            performance.put(model, new ModelPerformance(modelResults.size(), mentions, round2(confidence), errors));
        });

        return new ProcessingStats(total, successful.size(), round2(mentionRate), round2(avgConfidence),
                distribution, performance);
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
