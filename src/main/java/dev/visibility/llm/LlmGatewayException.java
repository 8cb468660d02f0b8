package dev.visibility.llm;

import dev.visibility.retry.ErrorContext;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.retry.ProcessingError;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;

/**
 * Failure talking to an LLM backend, classified by HTTP status.
 */
@Getter
public class LlmGatewayException extends ProcessingError {

    private static final int MAX_BODY_LENGTH = 300;

    private final int statusCode;
    private final LlmErrorKind kind;

    public LlmGatewayException(String message, int statusCode, LlmErrorKind kind, String model) {
        this(message, statusCode, kind, model, null);
    }

    public LlmGatewayException(String message, int statusCode, LlmErrorKind kind, String model, Throwable cause) {
        super(message, "LLM_" + kind.name(), kind.isRetryable(),
                ErrorContext.of("llm.query").withMetadata(Map.of("model", model == null ? "unknown" : model)),
                cause);
        this.statusCode = statusCode;
        this.kind = kind;
    }

    public static LlmGatewayException fromStatus(int status, String body, String model) {
        LlmErrorKind kind = LlmErrorKind.fromStatus(status);
        String detail = body == null ? "" : ErrorSanitizer.sanitize(body.trim());
        if (detail.length() > MAX_BODY_LENGTH) {
            detail = detail.substring(0, MAX_BODY_LENGTH) + "...";
        }
        String label = kind == LlmErrorKind.RATE_LIMITED ? " Rate Limit" : "";
        return new LlmGatewayException(
                String.format("LLM API error %d%s for model %s: %s", status, label, model, detail),
                status, kind, model);
    }

    public static LlmGatewayException timeout(String model, Duration timeout) {
        return new LlmGatewayException(
                String.format("LLM request to %s timed out after %dms", model, timeout.toMillis()),
                0, LlmErrorKind.TIMEOUT, model);
    }

    public static LlmGatewayException network(String model, Throwable cause) {
        return new LlmGatewayException(
                String.format("LLM network error for model %s: %s", model, ErrorSanitizer.sanitize(cause)),
                0, LlmErrorKind.NETWORK, model, cause);
    }

    public static LlmGatewayException invalidResponse(String model, String reason) {
        return new LlmGatewayException(
                String.format("Invalid LLM response from %s: %s", model, reason),
                0, LlmErrorKind.INVALID_RESPONSE, model);
    }

    public static LlmGatewayException missingApiKey(String model) {
        return new LlmGatewayException("LLM API key is not configured", 401, LlmErrorKind.AUTHENTICATION, model);
    }
}
