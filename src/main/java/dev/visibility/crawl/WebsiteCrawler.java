package dev.visibility.crawl;

import dev.visibility.model.CrawlResult;
import reactor.core.publisher.Mono;

/**
 * Interface for fetching structured business facts from a website.
 */
public interface WebsiteCrawler {

    /**
     * Crawl the given URL. Failures are reported in the result, not as error signals.
     */
    Mono<CrawlResult> crawl(String url);
}
