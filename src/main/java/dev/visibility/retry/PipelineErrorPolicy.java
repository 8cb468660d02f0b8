package dev.visibility.retry;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides how a pipeline proceeds after its crawl and fingerprint stages settle.
 */
@Slf4j
public final class PipelineErrorPolicy {

    private PipelineErrorPolicy() {
    }

    /**
     * Crawl output is a hard precondition. A fingerprint failure alone leaves
     * the run usable in degraded mode.
     */
    public static ParallelErrorDecision handleParallelProcessingError(
            Throwable crawlError, Throwable fingerprintError, ErrorContext context) {
        List<String> errors = new ArrayList<>();
        if (crawlError != null) {
            errors.add("Crawl failed: " + ErrorSanitizer.sanitize(crawlError));
        }
        if (fingerprintError != null) {
            errors.add("Fingerprint failed: " + ErrorSanitizer.sanitize(fingerprintError));
        }

        if (crawlError != null) {
            log.error("[{}] crawl failed, halting pipeline: {}", operation(context), errors);
            return new ParallelErrorDecision(false, false, errors);
        }
        if (fingerprintError != null) {
            log.warn("[{}] fingerprint failed, continuing in degraded mode: {}", operation(context), errors);
            return new ParallelErrorDecision(true, true, errors);
        }
        return new ParallelErrorDecision(true, false, errors);
    }

    private static String operation(ErrorContext context) {
        return context != null ? context.operation() : "pipeline";
    }
}
