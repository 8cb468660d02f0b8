package dev.visibility.analysis;

import java.util.List;

public record MentionAnalysis(
        boolean mentioned,
        double confidence,
        MatchType matchType,
        List<String> variants,
        String reasoning) {

    public static MentionAnalysis none(double confidence, String reasoning) {
        return new MentionAnalysis(false, confidence, MatchType.NONE, List.of(), reasoning);
    }
}
