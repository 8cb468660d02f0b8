package dev.visibility.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Exponential-backoff retry for reactive operations.
 */
@Slf4j
@Component
public class RetryExecutor {

    private static final double JITTER_RATIO = 0.25;

    /**
     * Check if an error message contains one of the configured transient fragments.
     */
    public static boolean isRetryableError(Throwable error, RetryConfig config) {
        if (error == null || config == null) {
            return false;
        }
        List<String> patterns = config.retryableErrors();
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        String message = error.getMessage();
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return patterns.stream()
                .filter(p -> p != null && !p.isEmpty())
                .anyMatch(p -> lower.contains(p.toLowerCase(Locale.ROOT)));
    }

    /**
     * Capped exponential delay with symmetric jitter of 25% of the capped value.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public static long calculateRetryDelay(int attempt, RetryConfig config) {
        int exponent = Math.max(0, attempt - 1);
        double exponential = config.baseDelayMs() * Math.pow(config.backoffMultiplier(), exponent);
        double capped = Math.min(exponential, config.maxDelayMs());
        double jitter = capped * JITTER_RATIO * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Math.max(0, Math.round(capped + jitter));
    }

    /**
     * Subscribe to the operation up to {@code maxAttempts} times.
     * A non-retryable failure is propagated as-is after one attempt; an exhausted
     * retryable failure is wrapped in {@link ProcessingError#MAX_RETRIES_EXCEEDED}.
     */
    public <T> Mono<T> withRetry(Supplier<Mono<T>> operation, ErrorContext context, RetryConfig config) {
        return attempt(operation, context, config, 1);
    }

    private <T> Mono<T> attempt(Supplier<Mono<T>> operation, ErrorContext context, RetryConfig config, int attempt) {
        return Mono.defer(operation)
                .onErrorResume(error -> {
                    String message = ErrorSanitizer.sanitize(error);
                    String operationName = context != null ? context.operation() : "operation";
                    log.debug("{} attempt {}/{} failed: {}", operationName, attempt, config.maxAttempts(), message);

                    if (!shouldRetry(error, config)) {
                        log.error("{} failed with non-retryable error: {}", operationName, message);
                        return Mono.error(error);
                    }

                    if (attempt >= config.maxAttempts()) {
                        log.error("{} failed after {} attempts: {}", operationName, attempt, message);
                        ErrorContext finalContext = context != null
                                ? context.withAttempt(attempt)
                                : ErrorContext.of(operationName).withAttempt(attempt);
                        return Mono.error(new ProcessingError(
                                "Operation failed after " + attempt + " attempts: " + message,
                                ProcessingError.MAX_RETRIES_EXCEEDED, false, finalContext, error));
                    }

                    long delay = calculateRetryDelay(attempt, config);
                    log.warn("{} attempt {} failed, retrying in {}ms: {}", operationName, attempt, delay, message);
                    return Mono.delay(Duration.ofMillis(delay))
                            .then(attempt(operation, context, config, attempt + 1));
                });
    }

    private boolean shouldRetry(Throwable error, RetryConfig config) {
        if (error instanceof ProcessingError && !((ProcessingError) error).isRetryable()) {
            return false;
        }
        return isRetryableError(error, config);
    }
}
