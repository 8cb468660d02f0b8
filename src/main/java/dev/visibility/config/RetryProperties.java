package dev.visibility.config;

import dev.visibility.retry.RetryConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-operation retry overrides under the 'retry' prefix.
 * Operations without an override fall back to the built-in presets.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "retry")
public class RetryProperties {

    public static final String LLM = "llm";
    public static final String CRAWL = "crawl";
    public static final String DATABASE = "database";

    private Map<String, RetryConfig> operations = new HashMap<>();

    public RetryConfig forOperation(String name) {
        RetryConfig configured = operations.get(name);
        if (configured != null && configured.maxAttempts() > 0) {
            return configured;
        }
        String key = name.toLowerCase(Locale.ROOT);
        if (CRAWL.equals(key)) {
            return RetryConfig.CRAWL;
        }
        if (DATABASE.equals(key)) {
            return RetryConfig.DATABASE;
        }
        return RetryConfig.LLM;
    }
}
