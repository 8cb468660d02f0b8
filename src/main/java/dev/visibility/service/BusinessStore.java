package dev.visibility.service;

import dev.visibility.fingerprint.FingerprintAnalysis;
import dev.visibility.model.Business;
import dev.visibility.model.BusinessPatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract used by the pipeline. Calls are blocking; callers
 * shift them off event-loop threads.
 */
public interface BusinessStore {

    String JOB_RUNNING = "running";
    String JOB_COMPLETED = "completed";
    String JOB_FAILED = "failed";

    Optional<Business> getBusinessById(Long id);

    /**
     * Businesses with automation enabled whose next crawl is unset or at/before {@code now}.
     */
    List<Business> findAutomationCandidates(Instant now);

    /**
     * As {@link #findAutomationCandidates(Instant)}, plus businesses never crawled or
     * last crawled before {@code staleBefore}.
     */
    List<Business> findAutomationCandidates(Instant now, Instant staleBefore);

    Business updateBusiness(Long id, BusinessPatch patch);

    Long createFingerprint(Long businessId, FingerprintAnalysis analysis);

    Long createCrawlJob(Long businessId, String jobType);

    void updateCrawlJob(Long jobId, String status, String errorMessage);
}
