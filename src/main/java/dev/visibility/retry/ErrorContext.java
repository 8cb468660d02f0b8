package dev.visibility.retry;

import java.util.Map;

/**
 * Diagnostic details attached to a failure. Holds no credentials.
 */
public record ErrorContext(
        String operation,
        Long businessId,
        Long jobId,
        String url,
        Integer attempt,
        Map<String, Object> metadata) {

    public ErrorContext {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ErrorContext of(String operation) {
        return new ErrorContext(operation, null, null, null, null, Map.of());
    }

    public static ErrorContext forBusiness(String operation, Long businessId) {
        return new ErrorContext(operation, businessId, null, null, null, Map.of());
    }

    public ErrorContext withUrl(String url) {
        return new ErrorContext(operation, businessId, jobId, url, attempt, metadata);
    }

    public ErrorContext withJobId(Long jobId) {
        return new ErrorContext(operation, businessId, jobId, url, attempt, metadata);
    }

    public ErrorContext withAttempt(int attempt) {
        return new ErrorContext(operation, businessId, jobId, url, attempt, metadata);
    }

    public ErrorContext withMetadata(Map<String, Object> metadata) {
        return new ErrorContext(operation, businessId, jobId, url, attempt, metadata);
    }
}
