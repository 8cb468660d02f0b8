package dev.visibility.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.visibility.llm.LlmQuery;
import dev.visibility.llm.PromptType;

import java.util.List;

/**
 * Analysis of one LLM reply. Every query yields exactly one of these;
 * failures are carried in {@code error} instead of being thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        String model,
        PromptType promptType,
        boolean mentioned,
        Sentiment sentiment,
        double confidence,
        Integer rankPosition,
        List<String> competitorMentions,
        String rawResponse,
        int tokensUsed,
        String prompt,
        long processingTimeMs,
        String error) {

    public QueryResult {
        competitorMentions = competitorMentions == null ? List.of() : List.copyOf(competitorMentions);
    }

    public static QueryResult failed(LlmQuery query, String error) {
        return new QueryResult(query.model(), query.promptType(), false, Sentiment.NEUTRAL, 0.0, null,
                List.of(), "", 0, query.prompt(), 0, error);
    }

    public QueryResult withPrompt(String prompt) {
        return new QueryResult(model, promptType, mentioned, sentiment, confidence, rankPosition,
                competitorMentions, rawResponse, tokensUsed, prompt, processingTimeMs, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
