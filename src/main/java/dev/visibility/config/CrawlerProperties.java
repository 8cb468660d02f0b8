package dev.visibility.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private Duration timeout = Duration.ofSeconds(30);
    private String userAgent = "Mozilla/5.0 (compatible; AIVisibilityBot/1.0)";
    private int maxBodySizeMb = 10;
}
