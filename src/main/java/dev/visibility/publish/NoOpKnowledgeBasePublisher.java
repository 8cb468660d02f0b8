package dev.visibility.publish;

import dev.visibility.model.BusinessContext;
import dev.visibility.model.CrawlData;
import dev.visibility.model.Location;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publisher used when no knowledge-base integration is configured.
 * Builds a basic entity but never reports notability, so nothing is published.
 */
@Slf4j
@Service
public class NoOpKnowledgeBasePublisher implements KnowledgeBasePublisher {

    public NoOpKnowledgeBasePublisher() {
        log.info("Knowledge-base publishing disabled - using no-op publisher");
    }

    @Override
    public Mono<KnowledgeEntity> buildEntity(BusinessContext business, CrawlData crawlData) {
        Map<String, String> claims = new LinkedHashMap<>();
        if (business.url() != null) {
            claims.put("official_website", business.url());
        }
        if (business.location() != null && !business.location().display().isEmpty()) {
            claims.put("located_in", business.location().display());
        }
        if (crawlData != null && crawlData.phone() != null) {
            claims.put("phone_number", crawlData.phone());
        }
        String description = crawlData != null && crawlData.description() != null
                ? crawlData.description()
                : "Local business";
        return Mono.just(new KnowledgeEntity(business.name(), description, claims, null));
    }

    @Override
    public Mono<NotabilityResult> checkNotability(String businessName, Location location) {
        return Mono.just(new NotabilityResult(false, 0.0, List.of("Notability checking not configured"), List.of()));
    }

    @Override
    public Mono<PublishResult> publishEntity(KnowledgeEntity entity, boolean toProduction) {
        return Mono.just(PublishResult.failed("Publishing disabled"));
    }
}
