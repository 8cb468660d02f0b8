package dev.visibility.retry;

import java.util.List;

/**
 * Outcome of evaluating crawl and fingerprint failures together.
 */
public record ParallelErrorDecision(boolean shouldContinue, boolean degradedMode, List<String> errors) {

    public ParallelErrorDecision {
        errors = List.copyOf(errors);
    }
}
