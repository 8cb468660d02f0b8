package dev.visibility.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM gateway settings under the 'app.llm' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    private String provider = "simulated";
    private String apiKey = "";
    private String baseUrl = "https://openrouter.ai/api/v1";
    private String referer = "https://github.com/ai-visibility-engine";
    private String title = "AI Visibility Engine";
    private List<String> models = new ArrayList<>(List.of(
            "openai/gpt-4-turbo",
            "anthropic/claude-3-opus",
            "google/gemini-2.5-flash"));
    private double temperature = 0.7;
    private int maxTokens = 2000;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Cache cache = new Cache();
    private Parallelism parallelism = new Parallelism();

    @Data
    public static class Cache {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Parallelism {
        private int batchSize = 9;
        /**
         * Batches dispatched together in one wave.
         */
        private int maxConcurrency = 3;
        /**
         * Requests in flight per gateway fan-out; 0 sends a whole batch at once.
         */
        private int maxInFlight = 0;
        private Duration pauseBetweenBatches = Duration.ofMillis(200);
    }
}
