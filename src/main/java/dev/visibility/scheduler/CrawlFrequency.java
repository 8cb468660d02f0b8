package dev.visibility.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * How often a tier re-runs the pipeline for a business.
 */
public enum CrawlFrequency {
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30)),
    MANUAL(null);

    private final Duration cycle;

    CrawlFrequency(Duration cycle) {
        this.cycle = cycle;
    }

    /**
     * Nominal length of one cycle, empty for {@link #MANUAL}.
     */
    public Optional<Duration> cycle() {
        return Optional.ofNullable(cycle);
    }

    public boolean isAutomatic() {
        return cycle != null;
    }

    /**
     * Next due instant after a run finishing at {@code from}. Monthly uses calendar months in UTC.
     */
    public Optional<Instant> nextRunAfter(Instant from) {
        if (this == MANUAL) {
            return Optional.empty();
        }
        if (this == MONTHLY) {
            return Optional.of(from.atZone(ZoneOffset.UTC).plusMonths(1).toInstant());
        }
        return Optional.of(from.plus(cycle));
    }
}
