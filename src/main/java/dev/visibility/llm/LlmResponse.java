package dev.visibility.llm;

public record LlmResponse(
        String content,
        int tokensUsed,
        String model,
        boolean cached,
        long processingTimeMs) {

    public LlmResponse asCached() {
        return new LlmResponse(content, tokensUsed, model, true, 0);
    }

    public LlmResponse withProcessingTime(long processingTimeMs) {
        return new LlmResponse(content, tokensUsed, model, cached, processingTimeMs);
    }
}
