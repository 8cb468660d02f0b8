package dev.visibility.llm;

/**
 * Per-request sampling overrides. Null means "use the configured default".
 */
public record QueryOptions(Double temperature, Integer maxTokens) {

    public static QueryOptions defaults() {
        return new QueryOptions(null, null);
    }
}
