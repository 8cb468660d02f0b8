package dev.visibility.retry;

import java.util.List;

/**
 * Backoff settings for one class of operation.
 *
 * @param maxAttempts       total attempts, including the first one
 * @param baseDelayMs       delay before the second attempt
 * @param maxDelayMs        upper bound applied before jitter
 * @param backoffMultiplier growth factor per attempt
 * @param retryableErrors   case-insensitive message fragments that mark an error as transient
 */
public record RetryConfig(
        int maxAttempts,
        long baseDelayMs,
        long maxDelayMs,
        double backoffMultiplier,
        List<String> retryableErrors) {

    public static final RetryConfig LLM = new RetryConfig(2, 1000, 10000, 2.0,
            List.of("Rate Limit", "timeout", "network", "429", "502", "503"));

    public static final RetryConfig CRAWL = new RetryConfig(3, 2000, 30000, 2.0,
            List.of("Rate Limit", "timeout", "network", "429", "502", "503", "504"));

    public static final RetryConfig DATABASE = new RetryConfig(3, 500, 5000, 1.5,
            List.of("connection", "timeout", "deadlock"));

    public RetryConfig {
        retryableErrors = retryableErrors == null ? List.of() : List.copyOf(retryableErrors);
    }
}
