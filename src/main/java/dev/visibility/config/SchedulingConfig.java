package dev.visibility.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on cron-driven automation passes.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "automation.scheduling.enabled", havingValue = "true")
public class SchedulingConfig {
}
