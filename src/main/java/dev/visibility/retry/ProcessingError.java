package dev.visibility.retry;

import lombok.Getter;

/**
 * Typed failure raised by pipeline stages and the retry loop.
 */
@Getter
public class ProcessingError extends RuntimeException {

    public static final String MAX_RETRIES_EXCEEDED = "MAX_RETRIES_EXCEEDED";
    public static final String CRAWL_FAILED = "CRAWL_FAILED";
    public static final String FINGERPRINT_FAILED = "FINGERPRINT_FAILED";
    public static final String BUSINESS_NOT_FOUND = "BUSINESS_NOT_FOUND";
    public static final String INVALID_URL = "INVALID_URL";

    private final String code;
    private final boolean retryable;
    private final transient ErrorContext context;

    public ProcessingError(String message, String code, boolean retryable, ErrorContext context) {
        super(message);
        this.code = code;
        this.retryable = retryable;
        this.context = context;
    }

    public ProcessingError(String message, String code, boolean retryable, ErrorContext context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
        this.context = context;
    }
}
