package dev.visibility.analysis;

import java.util.List;

/**
 * @param score signed balance of indicators in [-1, 1]
 */
public record SentimentAnalysis(
        Sentiment sentiment,
        double confidence,
        double score,
        List<String> keywords,
        String reasoning) {
}
