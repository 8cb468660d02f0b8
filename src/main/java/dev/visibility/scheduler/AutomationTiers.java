package dev.visibility.scheduler;

import dev.visibility.config.AutomationProperties;
import dev.visibility.config.AutomationProperties.Tier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a business plan name to its automation tier.
 */
@Component
@RequiredArgsConstructor
public class AutomationTiers {

    public static final String FREE = "free";

    private static final Tier MANUAL_TIER = new Tier(CrawlFrequency.MANUAL, false);

    private final AutomationProperties properties;

    /**
     * Unknown or missing plans fall back to the free tier.
     */
    public Tier forPlan(String plan) {
        if (plan != null) {
            Tier tier = properties.getTiers().get(plan.trim().toLowerCase(Locale.ROOT));
            if (tier != null) {
                return tier;
            }
        }
        Tier free = properties.getTiers().get(FREE);
        return free != null ? free : MANUAL_TIER;
    }

    /**
     * Shortest cycle among automatic tiers, empty when every tier is manual.
     */
    public Optional<Duration> shortestCycle() {
        return properties.getTiers().values().stream()
                .filter(tier -> tier.getCrawlFrequency() != null)
                .map(tier -> tier.getCrawlFrequency().cycle())
                .flatMap(Optional::stream)
                .min(Duration::compareTo);
    }
}
