package dev.visibility.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A tracked business as the pipeline sees it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Business {
    private Long id;
    private String name;
    private String url;
    private String category;
    private Location location;
    private String plan;
    private boolean automationEnabled;
    private BusinessStatus status;
    private CrawlData crawlData;
    private Instant lastCrawledAt;
    private Instant nextCrawlAt;
    private String wikidataQid;
    private Instant publishedAt;

    public BusinessContext toContext() {
        return new BusinessContext(id, name, url, category, location, crawlData);
    }
}
