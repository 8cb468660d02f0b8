package dev.visibility.llm;

import dev.visibility.config.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Response cache backed by a ConcurrentHashMap. Writers on the same key race
 * last-write-wins; entries expire after the configured TTL.
 */
@Slf4j
@Component
public class InMemoryResponseCache implements ResponseCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public InMemoryResponseCache(LlmProperties properties, Clock clock) {
        this(properties.getCache().getTtl(), clock);
    }

    public InMemoryResponseCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Optional<LlmResponse> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.response());
    }

    @Override
    public void put(String key, LlmResponse response) {
        entries.put(key, new Entry(response, clock.instant().plus(ttl)));
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            log.debug("Evicted {} expired LLM cache entries", removed);
        }
        return removed;
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record Entry(LlmResponse response, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
