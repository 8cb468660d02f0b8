package dev.visibility.model;

public record CrawlResult(boolean success, CrawlData data, String error) {

    public static CrawlResult success(CrawlData data) {
        return new CrawlResult(true, data, null);
    }

    public static CrawlResult failed(String error) {
        return new CrawlResult(false, null, error);
    }
}
