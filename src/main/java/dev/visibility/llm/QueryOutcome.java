package dev.visibility.llm;

/**
 * Settled result of one query in a parallel batch: either a response or the error that replaced it.
 */
public record QueryOutcome(LlmQuery query, LlmResponse response, Throwable error) {

    public static QueryOutcome success(LlmQuery query, LlmResponse response) {
        return new QueryOutcome(query, response, null);
    }

    public static QueryOutcome failure(LlmQuery query, Throwable error) {
        return new QueryOutcome(query, null, error);
    }

    public boolean isSuccess() {
        return error == null && response != null;
    }
}
