package dev.visibility.cfp;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.visibility.fingerprint.FingerprintAnalysis;
import dev.visibility.model.BusinessContext;
import dev.visibility.model.CrawlData;
import dev.visibility.publish.KnowledgeEntity;
import dev.visibility.publish.PublishResult;

import java.time.Instant;

/**
 * Outcome of one CFP run. Stages that did not run leave their field absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CfpResult(
        boolean success,
        String url,
        BusinessContext business,
        CrawlData crawlData,
        FingerprintAnalysis fingerprint,
        KnowledgeEntity entity,
        PublishResult publishResult,
        boolean degradedMode,
        long processingTimeMs,
        Instant timestamp,
        String error,
        PartialResults partialResults) {
}
