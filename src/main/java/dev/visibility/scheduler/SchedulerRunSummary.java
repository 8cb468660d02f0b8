package dev.visibility.scheduler;

import java.util.List;

/**
 * Counts and per-business outcomes of one automation pass.
 *
 * @param due       businesses that passed the due check
 * @param processed businesses handed to the orchestrator, at most the batch size
 * @param deferred  due businesses left for the next pass
 */
public record SchedulerRunSummary(
        int due,
        int processed,
        int succeeded,
        int failed,
        int deferred,
        List<BusinessOutcome> outcomes) {

    public SchedulerRunSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static SchedulerRunSummary empty() {
        return new SchedulerRunSummary(0, 0, 0, 0, 0, List.of());
    }

    public long skipped() {
        return outcomes.stream().filter(o -> o.status() == BusinessOutcome.Status.SKIPPED).count();
    }
}
