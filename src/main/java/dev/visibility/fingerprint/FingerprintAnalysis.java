package dev.visibility.fingerprint;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.visibility.analysis.QueryResult;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate visibility measurement for one business and one run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FingerprintAnalysis(
        Long businessId,
        String businessName,
        int visibilityScore,
        double mentionRate,
        double sentimentScore,
        double avgConfidence,
        Double avgRankPosition,
        int totalQueries,
        int successfulQueries,
        CompetitiveLeaderboard competitiveLeaderboard,
        List<QueryResult> results,
        Instant generatedAt,
        long processingTimeMs,
        String error) {

    public FingerprintAnalysis {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
