package dev.visibility.publish;

import java.util.List;

public record NotabilityResult(
        boolean isNotable,
        double confidence,
        List<String> reasons,
        List<String> references) {

    public NotabilityResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        references = references == null ? List.of() : List.copyOf(references);
    }
}
