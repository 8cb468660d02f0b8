package dev.visibility.scheduler;

import dev.visibility.config.AutomationProperties.Tier;
import dev.visibility.model.Business;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Due-ness predicate for scheduled automation. Re-derived on every pass from
 * {@code nextCrawlAt}; no schedule queue is kept.
 */
public final class SchedulePolicy {

    private SchedulePolicy() {
    }

    /**
     * A business is due when automation is on, its tier crawls automatically, and
     * {@code nextCrawlAt} is unset or not after {@code now}. With {@code catchMissed}
     * a business whose last crawl is older than one cycle is due as well, whatever
     * {@code nextCrawlAt} says.
     */
    public static boolean isDue(Business business, Tier tier, Instant now, boolean catchMissed) {
        if (business == null || !business.isAutomationEnabled()) {
            return false;
        }
        if (tier == null || tier.getCrawlFrequency() == null || !tier.getCrawlFrequency().isAutomatic()) {
            return false;
        }
        Instant next = business.getNextCrawlAt();
        if (next == null) {
            return true;
        }
        if (!next.isAfter(now)) {
            return true;
        }
        return catchMissed && isStale(business, tier, now);
    }

    /**
     * True when the business was never crawled or its last crawl lies more than one cycle before {@code now}.
     */
    public static boolean isStale(Business business, Tier tier, Instant now) {
        if (tier == null || tier.getCrawlFrequency() == null) {
            return false;
        }
        Optional<Duration> cycle = tier.getCrawlFrequency().cycle();
        if (cycle.isEmpty()) {
            return false;
        }
        Instant last = business.getLastCrawledAt();
        return last == null || Duration.between(last, now).compareTo(cycle.get()) > 0;
    }

    /**
     * True when {@code nextCrawlAt} lies more than one full cycle before {@code now}.
     */
    public static boolean isMissed(Business business, Tier tier, Instant now) {
        Instant next = business.getNextCrawlAt();
        if (next == null || tier == null || tier.getCrawlFrequency() == null) {
            return false;
        }
        Optional<Duration> cycle = tier.getCrawlFrequency().cycle();
        return cycle.isPresent() && Duration.between(next, now).compareTo(cycle.get()) > 0;
    }
}
