package dev.visibility.processor;

import dev.visibility.analysis.Sentiment;

import java.util.Map;

/**
 * Observability summary of one processed batch.
 */
public record ProcessingStats(
        int totalQueries,
        int successfulQueries,
        double mentionRate,
        double avgConfidence,
        Map<Sentiment, Long> sentimentDistribution,
        Map<String, ModelPerformance> modelPerformance) {

    public record ModelPerformance(int queries, int mentions, double avgConfidence, int errors) {
    }
}
