package dev.visibility.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Partial business update. Null fields are left untouched.
 */
@Builder
public record BusinessPatch(
        String name,
        BusinessStatus status,
        CrawlData crawlData,
        Instant lastCrawledAt,
        Instant nextCrawlAt,
        String wikidataQid,
        Instant publishedAt,
        String errorMessage) {

    public static BusinessPatch ofStatus(BusinessStatus status) {
        return BusinessPatch.builder().status(status).build();
    }
}
