package dev.visibility.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for fingerprinting and pipeline runs.
 */
@Component
public class VisibilityMetrics {

    private static final String TAG_MODEL = "model";
    private static final String TAG_OUTCOME = "outcome";
    private final MeterRegistry registry;

    // Counters
    private final Counter llmQueriesCounter;
    private final Counter llmErrorsCounter;
    private final Counter cacheHitsCounter;
    private final Counter fingerprintsCounter;
    private final Counter businessesProcessedCounter;

    // Timers (per model)
    private final ConcurrentHashMap<String, Timer> modelTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastVisibilityScore = new AtomicInteger(0);
    private final AtomicInteger lastRunBusinessesDue = new AtomicInteger(0);
    private final AtomicInteger lastRunBusinessesProcessed = new AtomicInteger(0);

    public VisibilityMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.llmQueriesCounter = Counter.builder("visibility_llm_queries_total")
                .description("Total LLM queries issued")
                .register(registry);

        this.llmErrorsCounter = Counter.builder("visibility_llm_errors_total")
                .description("Total LLM queries that failed")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("visibility_llm_cache_hits_total")
                .description("Total LLM responses served from the local cache")
                .register(registry);

        this.fingerprintsCounter = Counter.builder("visibility_fingerprints_total")
                .description("Total fingerprint analyses generated")
                .register(registry);

        this.businessesProcessedCounter = Counter.builder("visibility_scheduler_businesses_processed_total")
                .description("Total businesses processed by scheduled automation")
                .register(registry);

        Gauge.builder("visibility_last_fingerprint_score", lastVisibilityScore, AtomicInteger::get)
                .description("Visibility score of the most recent fingerprint")
                .register(registry);

        Gauge.builder("visibility_scheduler_last_run_due", lastRunBusinessesDue, AtomicInteger::get)
                .description("Businesses due in last scheduler pass")
                .register(registry);

        Gauge.builder("visibility_scheduler_last_run_processed", lastRunBusinessesProcessed, AtomicInteger::get)
                .description("Businesses processed in last scheduler pass")
                .register(registry);
    }

    /**
     * Get or create a latency timer for a model.
     */
    public Timer getModelTimer(String model) {
        return modelTimers.computeIfAbsent(model, name ->
                Timer.builder("visibility_llm_query_duration")
                        .description("Time to receive an LLM response")
                        .tag(TAG_MODEL, name)
                        .register(registry)
        );
    }

    public void recordLlmQuery(String model, long latencyMs) {
        llmQueriesCounter.increment();
        getModelTimer(model).record(Duration.ofMillis(latencyMs));
    }

    public void recordLlmError(String model, String kind) {
        llmErrorsCounter.increment();
        Counter.builder("visibility_llm_errors_by_model_total")
                .tag(TAG_MODEL, model)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordFingerprint(int visibilityScore) {
        fingerprintsCounter.increment();
        lastVisibilityScore.set(visibilityScore);
    }

    /**
     * Record a finished CFP run, tagged success / failed / partial.
     */
    public void recordCfpRun(String outcome) {
        Counter.builder("visibility_cfp_runs_total")
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }

    public void recordBusinessProcessed(String outcome) {
        businessesProcessedCounter.increment();
        Counter.builder("visibility_scheduler_businesses_by_outcome_total")
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }

    public void updateLastSchedulerRun(int due, int processed) {
        lastRunBusinessesDue.set(due);
        lastRunBusinessesProcessed.set(processed);
    }
}
