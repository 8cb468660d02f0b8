package dev.visibility.fingerprint;

import dev.visibility.config.LlmProperties;
import dev.visibility.llm.LlmQuery;
import dev.visibility.llm.PromptGenerator;
import dev.visibility.llm.PromptType;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.model.BusinessContext;
import dev.visibility.processor.ParallelQueryProcessor;
import dev.visibility.processor.ProcessingStats;
import dev.visibility.retry.ErrorSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the full model x prompt-type matrix for one business and aggregates it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessFingerprinter {

    private final PromptGenerator promptGenerator;
    private final ParallelQueryProcessor queryProcessor;
    private final FingerprintAggregator aggregator;
    private final LlmProperties llmProperties;
    private final VisibilityMetrics metrics;

    public Mono<FingerprintAnalysis> fingerprint(BusinessContext context) {
        long start = System.currentTimeMillis();
        return Mono.defer(() -> {
                    List<LlmQuery> queries = buildQueries(context);
                    log.info("Fingerprinting '{}' with {} queries across {} models",
                            context.name(), queries.size(), llmProperties.getModels().size());
                    return queryProcessor.processQueries(queries, context.name());
                })
                .map(results -> {
                    ProcessingStats stats = queryProcessor.statistics(results);
                    log.debug("Processing stats for '{}': {}", context.name(), stats);
                    return aggregator.aggregate(context.businessId(), context.name(), results,
                            System.currentTimeMillis() - start);
                })
                .doOnNext(analysis -> {
                    metrics.recordFingerprint(analysis.visibilityScore());
                    log.info("Fingerprint for '{}': visibility={} mentionRate={} successful={}/{}",
                            context.name(), analysis.visibilityScore(),
                            String.format("%.2f", analysis.mentionRate()),
                            analysis.successfulQueries(), analysis.totalQueries());
                })
                .onErrorResume(e -> {
                    String message = ErrorSanitizer.sanitize(e);
                    log.error("Fingerprinting failed for '{}': {}", context.name(), message);
                    return Mono.just(aggregator.failed(context.businessId(), context.name(),
                            System.currentTimeMillis() - start, "Fingerprint analysis failed: " + message));
                });
    }

    /**
     * One query per configured model and prompt type.
     */
    List<LlmQuery> buildQueries(BusinessContext context) {
        Map<PromptType, String> prompts = new EnumMap<>(PromptType.class);
        for (PromptType type : PromptType.values()) {
            prompts.put(type, promptGenerator.generate(context, type));
        }

        List<LlmQuery> queries = new ArrayList<>();
        for (String model : llmProperties.getModels()) {
            for (PromptType type : PromptType.values()) {
                queries.add(LlmQuery.of(model, prompts.get(type), type));
            }
        }
        return queries;
    }
}
