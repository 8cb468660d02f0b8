package dev.visibility.model;

/**
 * Read-only input shared by every query issued for one business.
 */
public record BusinessContext(
        Long businessId,
        String name,
        String url,
        String category,
        Location location,
        CrawlData crawlData) {

    public static BusinessContext of(String name, String url, String category, Location location) {
        return new BusinessContext(null, name, url, category, location, null);
    }
}
