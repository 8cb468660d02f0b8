package dev.visibility.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Structured facts extracted from a business website.
 */
@Builder
public record CrawlData(
        String name,
        String description,
        String category,
        String phone,
        String email,
        Location location,
        List<String> services,
        List<String> socialLinks,
        Instant crawledAt) {

    public CrawlData {
        services = services == null ? List.of() : List.copyOf(services);
        socialLinks = socialLinks == null ? List.of() : List.copyOf(socialLinks);
    }
}
