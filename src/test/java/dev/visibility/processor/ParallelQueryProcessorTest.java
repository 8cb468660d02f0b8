package dev.visibility.processor;

import dev.visibility.analysis.QueryResult;
import dev.visibility.analysis.ResponseAnalyzer;
import dev.visibility.analysis.Sentiment;
import dev.visibility.config.LlmProperties;
import dev.visibility.llm.LlmErrorKind;
import dev.visibility.llm.LlmGatewayClient;
import dev.visibility.llm.LlmGatewayException;
import dev.visibility.llm.LlmQuery;
import dev.visibility.llm.LlmResponse;
import dev.visibility.llm.PromptType;
import dev.visibility.llm.QueryOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParallelQueryProcessorTest {

    private static final String BUSINESS = "Acme Co";

    @Mock
    private LlmGatewayClient gatewayClient;

    private LlmProperties properties;
    private ParallelQueryProcessor processor;

    @BeforeEach
    void setUp() {
        properties = new LlmProperties();
        properties.getParallelism().setPauseBetweenBatches(Duration.ZERO);
        processor = new ParallelQueryProcessor(gatewayClient, new ResponseAnalyzer(), properties);
    }

    private static List<LlmQuery> queries(String... models) {
        PromptType[] types = PromptType.values();
        List<LlmQuery> queries = new java.util.ArrayList<>();
        for (int i = 0; i < models.length; i++) {
            queries.add(LlmQuery.of(models[i], "prompt " + i, types[i % types.length]));
        }
        return queries;
    }

    private static QueryOutcome mentioning(LlmQuery query) {
        return QueryOutcome.success(query,
                new LlmResponse("Acme Co is excellent and reliable.", 50, query.model(), false, 10));
    }

    @Nested
    @DisplayName("processQueries")
    class ProcessQueries {

        @Test
        @DisplayName("Should analyze every reply and keep input order")
        void shouldAnalyzeInOrder() {
            List<LlmQuery> queries = queries("a", "b", "c");
            when(gatewayClient.queryParallel(anyList())).thenAnswer(invocation -> {
                List<LlmQuery> batch = invocation.getArgument(0);
                return Mono.just(batch.stream().map(ParallelQueryProcessorTest::mentioning).toList());
            });

            StepVerifier.create(processor.processQueries(queries, BUSINESS))
                    .assertNext(results -> {
                        assertThat(results).hasSize(3);
                        assertThat(results).extracting(QueryResult::model).containsExactly("a", "b", "c");
                        assertThat(results).extracting(QueryResult::prompt)
                                .containsExactly("prompt 0", "prompt 1", "prompt 2");
                        assertThat(results).allMatch(QueryResult::mentioned);
                        assertThat(results).allMatch(r -> r.sentiment() == Sentiment.POSITIVE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should turn a failed outcome into an error result without affecting its neighbours")
        void shouldIsolateFailedOutcome() {
            List<LlmQuery> queries = queries("a", "b");
            when(gatewayClient.queryParallel(anyList())).thenAnswer(invocation -> {
                List<LlmQuery> batch = invocation.getArgument(0);
                return Mono.just(List.of(
                        mentioning(batch.get(0)),
                        QueryOutcome.failure(batch.get(1),
                                new LlmGatewayException("LLM API error 400 for model b: bad", 400, LlmErrorKind.CLIENT, "b"))));
            });

            StepVerifier.create(processor.processQueries(queries, BUSINESS))
                    .assertNext(results -> {
                        assertThat(results.get(0).isSuccess()).isTrue();
                        assertThat(results.get(1).isSuccess()).isFalse();
                        assertThat(results.get(1).error()).contains("LLM API error 400");
                        assertThat(results.get(1).prompt()).isEqualTo("prompt 1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return one failed result per query when the gateway errors outright")
        void shouldSurviveGatewayError() {
            List<LlmQuery> queries = queries("a", "b", "c", "a");
            when(gatewayClient.queryParallel(anyList())).thenReturn(Mono.error(new IllegalStateException("boom")));

            StepVerifier.create(processor.processQueries(queries, BUSINESS))
                    .assertNext(results -> {
                        assertThat(results).hasSize(4);
                        assertThat(results).noneMatch(QueryResult::isSuccess);
                        assertThat(results.get(0).error()).startsWith("Query processing failed");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fill in results for outcomes the gateway never returned")
        void shouldFillMissingOutcomes() {
            List<LlmQuery> queries = queries("a", "b");
            when(gatewayClient.queryParallel(anyList())).thenAnswer(invocation -> {
                List<LlmQuery> batch = invocation.getArgument(0);
                return Mono.just(List.of(mentioning(batch.get(0))));
            });

            StepVerifier.create(processor.processQueries(queries, BUSINESS))
                    .assertNext(results -> {
                        assertThat(results).hasSize(2);
                        assertThat(results.get(1).error()).isEqualTo("No response received");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should split an oversized workload into per-model batches")
        void shouldDispatchOneCallPerBatch() {
            properties.getParallelism().setBatchSize(2);
            when(gatewayClient.queryParallel(anyList())).thenAnswer(invocation -> {
                List<LlmQuery> batch = invocation.getArgument(0);
                return Mono.just(batch.stream().map(ParallelQueryProcessorTest::mentioning).toList());
            });

            StepVerifier.create(processor.processQueries(queries("a", "b", "a", "b", "a"), BUSINESS))
                    .assertNext(results -> assertThat(results).extracting(QueryResult::model)
                            .containsExactly("a", "b", "a", "b", "a"))
                    .verifyComplete();

            verify(gatewayClient, times(3)).queryParallel(anyList());
        }

        @Test
        @DisplayName("Should return an empty list for no queries")
        void shouldHandleEmptyInput() {
            StepVerifier.create(processor.processQueries(List.of(), BUSINESS))
                    .assertNext(results -> assertThat(results).isEmpty())
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should group by model and chunk to the batch size")
    void shouldCreateOptimizedBatches() {
        properties.getParallelism().setBatchSize(2);

        assertThat(processor.createOptimizedBatches(queries("a", "b", "a", "b", "a")))
                .containsExactly(List.of(0, 2), List.of(4), List.of(1, 3));
        assertThat(processor.createOptimizedBatches(queries("a", "b")))
                .containsExactly(List.of(0, 1));
    }

    @Test
    @DisplayName("Should summarize mentions, sentiment and per-model errors")
    void shouldComputeStatistics() {
        List<LlmQuery> queries = queries("a", "a", "b");
        List<QueryResult> results = List.of(
                new ResponseAnalyzer().analyze(mentioning(queries.get(0)).response(), BUSINESS, PromptType.FACTUAL),
                new ResponseAnalyzer().analyze(mentioning(queries.get(1)).response(), BUSINESS, PromptType.OPINION),
                QueryResult.failed(queries.get(2), "timeout"));

        ProcessingStats stats = processor.statistics(results);

        assertThat(stats.totalQueries()).isEqualTo(3);
        assertThat(stats.successfulQueries()).isEqualTo(2);
        assertThat(stats.mentionRate()).isEqualTo(0.67);
        assertThat(stats.sentimentDistribution()).containsEntry(Sentiment.POSITIVE, 2L);
        assertThat(stats.modelPerformance().get("a").mentions()).isEqualTo(2);
        assertThat(stats.modelPerformance().get("b").errors()).isEqualTo(1);
    }
}
