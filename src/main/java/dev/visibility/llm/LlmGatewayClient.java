package dev.visibility.llm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for issuing prompts to LLM backends.
 */
public interface LlmGatewayClient {

    /**
     * Send one prompt to one model.
     *
     * @return the decoded response, or an error signal carrying an {@link LlmGatewayException}
     */
    Mono<LlmResponse> query(String model, String prompt, QueryOptions options);

    default Mono<LlmResponse> query(LlmQuery query) {
        return query(query.model(), query.prompt(), query.options());
    }

    /**
     * Run all queries concurrently. The returned list is index-aligned with the
     * input and always has the same size; failures are captured per item.
     */
    Mono<List<QueryOutcome>> queryParallel(List<LlmQuery> queries);

    /**
     * Check if the gateway can reach a real backend.
     */
    boolean isEnabled();
}
