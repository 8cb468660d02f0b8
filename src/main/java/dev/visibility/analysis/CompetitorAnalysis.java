package dev.visibility.analysis;

import java.util.List;

public record CompetitorAnalysis(
        List<String> competitors,
        Integer targetRank,
        double confidence,
        String reasoning) {
}
