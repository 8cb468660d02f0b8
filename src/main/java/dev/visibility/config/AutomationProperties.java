package dev.visibility.config;

import dev.visibility.scheduler.CrawlFrequency;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scheduled automation settings under the 'automation' prefix.
 * Tier keys match the plan name stored on each business.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "automation")
public class AutomationProperties {

    private int batchSize = 10;
    private boolean catchMissed = true;
    private Scheduling scheduling = new Scheduling();
    private Map<String, Tier> tiers = new LinkedHashMap<>(Map.of(
            "free", new Tier(CrawlFrequency.MANUAL, false),
            "pro", new Tier(CrawlFrequency.WEEKLY, true),
            "agency", new Tier(CrawlFrequency.WEEKLY, true)));

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 0 * * * *";
    }

    @Data
    public static class Tier {
        private CrawlFrequency crawlFrequency = CrawlFrequency.MANUAL;
        private boolean autoPublish = false;

        public Tier() {
        }

        public Tier(CrawlFrequency crawlFrequency, boolean autoPublish) {
            this.crawlFrequency = crawlFrequency;
            this.autoPublish = autoPublish;
        }
    }
}
