package dev.visibility.publish;

import dev.visibility.model.BusinessContext;
import dev.visibility.model.CrawlData;
import dev.visibility.model.Location;
import reactor.core.publisher.Mono;

/**
 * Interface for building and publishing business entities to a knowledge base.
 */
public interface KnowledgeBasePublisher {

    Mono<KnowledgeEntity> buildEntity(BusinessContext business, CrawlData crawlData);

    Mono<NotabilityResult> checkNotability(String businessName, Location location);

    Mono<PublishResult> publishEntity(KnowledgeEntity entity, boolean toProduction);
}
