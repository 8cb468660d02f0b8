package dev.visibility.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Crawl-fingerprint-publish run settings under the 'cfp' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cfp")
public class CfpProperties {

    private Duration defaultTimeout = Duration.ofSeconds(60);
    private Duration maxTimeout = Duration.ofMinutes(2);
    private boolean requireFingerprint = true;
    private boolean publishToProduction = false;
}
