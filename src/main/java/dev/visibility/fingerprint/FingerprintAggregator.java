package dev.visibility.fingerprint;

import dev.visibility.analysis.QueryResult;
import dev.visibility.analysis.ResponseAnalyzer;
import dev.visibility.fingerprint.CompetitiveLeaderboard.Competitor;
import dev.visibility.fingerprint.CompetitiveLeaderboard.TargetBusiness;
import dev.visibility.llm.PromptType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces per-query results into a visibility score and competitive leaderboard.
 *
 * <p>Score weights (points out of 100): mention rate 40, sentiment 25,
 * average confidence 20, rank quality 15 (rank 1 earns 15, each place lower
 * costs 3). Failed queries cost up to 10 points in proportion to the failure rate.
 */
@Component
@RequiredArgsConstructor
public class FingerprintAggregator {

    static final double MENTION_WEIGHT = 40;
    static final double SENTIMENT_WEIGHT = 25;
    static final double CONFIDENCE_WEIGHT = 20;
    static final double RANK_WEIGHT = 15;
    static final double RANK_STEP = 3;
    static final double FAILURE_PENALTY = 10;

    private final ResponseAnalyzer responseAnalyzer;
    private final Clock clock;

    public FingerprintAnalysis aggregate(Long businessId, String businessName, List<QueryResult> results,
                                         long processingTimeMs) {
        int total = results.size();
        List<QueryResult> successful = results.stream().filter(QueryResult::isSuccess).toList();
        List<QueryResult> mentioned = results.stream().filter(QueryResult::mentioned).toList();

        double mentionRate = total == 0 ? 0.0 : (double) mentioned.size() / total;
        double sentimentScore = mentioned.stream()
                .mapToDouble(r -> r.sentiment().weight())
                .average()
                .orElse(0.0);
        double avgConfidence = successful.stream()
                .mapToDouble(QueryResult::confidence)
                .average()
                .orElse(0.0);
        Double avgRank = averageRank(mentioned);

        int visibilityScore = visibilityScore(total, successful.size(), mentionRate, sentimentScore,
                avgConfidence, avgRank);

        return new FingerprintAnalysis(
                businessId,
                businessName,
                visibilityScore,
                mentionRate,
                sentimentScore,
                avgConfidence,
                avgRank,
                total,
                successful.size(),
                buildLeaderboard(businessName, results),
                results,
                clock.instant(),
                processingTimeMs,
                null);
    }

    /**
     * Zero-valued analysis used when fingerprinting could not run at all.
     */
    public FingerprintAnalysis failed(Long businessId, String businessName, long processingTimeMs, String error) {
        return new FingerprintAnalysis(businessId, businessName, 0, 0.0, 0.0, 0.0, null, 0, 0,
                CompetitiveLeaderboard.empty(businessName), List.of(), clock.instant(), processingTimeMs, error);
    }

    int visibilityScore(int total, int successful, double mentionRate, double sentimentScore,
                        double avgConfidence, Double avgRank) {
        if (successful == 0 || total == 0) {
            return 0;
        }
        double rankQuality = avgRank == null ? 0.0 : Math.max(0.0, RANK_WEIGHT - (avgRank - 1) * RANK_STEP);
        double failureRate = 1.0 - (double) successful / total;

        double raw = mentionRate * MENTION_WEIGHT
                + sentimentScore * SENTIMENT_WEIGHT
                + avgConfidence * CONFIDENCE_WEIGHT
                + rankQuality
                - failureRate * FAILURE_PENALTY;

        // a run with any usable reply never scores exactly zero
        long rounded = Math.round(Math.max(0.0, Math.min(100.0, raw)));
        return (int) Math.max(1, rounded);
    }

    private Double averageRank(List<QueryResult> mentioned) {
        List<Integer> ranks = mentioned.stream()
                .map(QueryResult::rankPosition)
                .filter(Objects::nonNull)
                .toList();
        if (ranks.isEmpty()) {
            return null;
        }
        return ranks.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    CompetitiveLeaderboard buildLeaderboard(String businessName, List<QueryResult> results) {
        List<QueryResult> recommendations = results.stream()
                .filter(r -> r.promptType() == PromptType.RECOMMENDATION)
                .filter(QueryResult::isSuccess)
                .toList();

        if (recommendations.isEmpty()) {
            return CompetitiveLeaderboard.empty(businessName);
        }

        int targetMentions = 0;
        List<Integer> targetPositions = new ArrayList<>();
        Map<String, Tally> tallies = new LinkedHashMap<>();

        for (QueryResult result : recommendations) {
            if (result.mentioned()) {
                targetMentions++;
                if (result.rankPosition() != null) {
                    targetPositions.add(result.rankPosition());
                }
            }
            for (String name : result.competitorMentions()) {
                Tally tally = tallies.computeIfAbsent(name, n -> new Tally());
                tally.mentions++;
                Integer position = responseAnalyzer.findListPosition(result.rawResponse(), name);
                if (position != null) {
                    tally.positions.add(position);
                }
                if (result.mentioned()) {
                    tally.appearsWithTarget = true;
                }
            }
        }

        List<Competitor> competitors = tallies.entrySet().stream()
                .map(e -> new Competitor(e.getKey(), e.getValue().mentions, mean(e.getValue().positions),
                        e.getValue().appearsWithTarget))
                .sorted(Comparator.comparingInt(Competitor::mentionCount).reversed())
                .limit(CompetitiveLeaderboard.MAX_COMPETITORS)
                .toList();

        return new CompetitiveLeaderboard(
                new TargetBusiness(businessName, mean(targetPositions), targetMentions),
                competitors,
                recommendations.size());
    }

    private static Double mean(List<Integer> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }

    private static final class Tally {
        private int mentions;
        private final List<Integer> positions = new ArrayList<>();
        private boolean appearsWithTarget;
    }
}
