package dev.visibility.llm;

public record LlmQuery(
        String model,
        String prompt,
        PromptType promptType,
        Double temperature,
        Integer maxTokens) {

    public static LlmQuery of(String model, String prompt, PromptType promptType) {
        return new LlmQuery(model, prompt, promptType, promptType.defaultTemperature(), null);
    }

    public QueryOptions options() {
        return new QueryOptions(temperature, maxTokens);
    }
}
