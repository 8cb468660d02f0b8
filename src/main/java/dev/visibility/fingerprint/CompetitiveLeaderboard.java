package dev.visibility.fingerprint;

import java.util.List;

/**
 * Who else the models recommend, built from recommendation-type replies only.
 */
public record CompetitiveLeaderboard(
        TargetBusiness targetBusiness,
        List<Competitor> competitors,
        int totalRecommendationQueries) {

    public static final int MAX_COMPETITORS = 10;

    public CompetitiveLeaderboard {
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }

    public static CompetitiveLeaderboard empty(String businessName) {
        return new CompetitiveLeaderboard(new TargetBusiness(businessName, null, 0), List.of(), 0);
    }

    public record TargetBusiness(String name, Double avgPosition, int mentionCount) {
    }

    public record Competitor(String name, int mentionCount, Double avgPosition, boolean appearsWithTarget) {
    }
}
