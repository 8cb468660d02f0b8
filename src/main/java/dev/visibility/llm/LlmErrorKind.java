package dev.visibility.llm;

/**
 * Status-derived classification of a gateway failure.
 */
public enum LlmErrorKind {
    AUTHENTICATION(false),
    RATE_LIMITED(true),
    TRANSIENT(true),
    CLIENT(false),
    TIMEOUT(false),
    NETWORK(true),
    INVALID_RESPONSE(false),
    UNKNOWN(false);

    private final boolean retryable;

    LlmErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static LlmErrorKind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500 && status < 600) {
            return TRANSIENT;
        }
        if (status >= 400 && status < 500) {
            return CLIENT;
        }
        return UNKNOWN;
    }
}
