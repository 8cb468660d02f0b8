package dev.visibility.cfp;

import dev.visibility.config.AutomationProperties.Tier;
import dev.visibility.config.CfpProperties;
import dev.visibility.config.RetryProperties;
import dev.visibility.crawl.WebsiteCrawler;
import dev.visibility.fingerprint.BusinessFingerprinter;
import dev.visibility.fingerprint.FingerprintAnalysis;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.model.Business;
import dev.visibility.model.BusinessContext;
import dev.visibility.model.BusinessPatch;
import dev.visibility.model.BusinessStatus;
import dev.visibility.model.CrawlData;
import dev.visibility.model.CrawlResult;
import dev.visibility.model.Location;
import dev.visibility.publish.KnowledgeBasePublisher;
import dev.visibility.publish.KnowledgeEntity;
import dev.visibility.publish.PublishResult;
import dev.visibility.retry.ErrorContext;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.retry.ParallelErrorDecision;
import dev.visibility.retry.PipelineErrorPolicy;
import dev.visibility.retry.ProcessingError;
import dev.visibility.retry.RetryExecutor;
import dev.visibility.scheduler.AutomationTiers;
import dev.visibility.service.BusinessStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Sequences Crawl, Fingerprint, entity build and Publish for one business.
 * Always completes with a {@link CfpResult}; failures end up in its flags and error text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CfpOrchestrator {

    public static final String CANCELLED = "CFP_CANCELLED";
    public static final String TIMED_OUT = "CFP_TIMEOUT";
    public static final String CANCELLED_MESSAGE = "CFP run cancelled";
    public static final String UNKNOWN_BUSINESS = "Unknown Business";

    private static final String SEPARATOR = "========================================";
    private static final String DEFAULT_CATEGORY = "business";
    private static final String JOB_TYPE = "cfp";

    private final WebsiteCrawler crawler;
    private final BusinessFingerprinter fingerprinter;
    private final KnowledgeBasePublisher publisher;
    private final BusinessStore store;
    private final AutomationTiers automationTiers;
    private final RetryExecutor retryExecutor;
    private final RetryProperties retryProperties;
    private final CfpProperties properties;
    private final VisibilityMetrics metrics;
    private final Clock clock;

    public Mono<CfpResult> execute(CfpRequest request) {
        return execute(request, CfpProgressListener.NOOP, new CfpCancellation());
    }

    /**
     * Run the pipeline. The returned Mono never errors and completes within the effective timeout.
     */
    public Mono<CfpResult> execute(CfpRequest request, CfpProgressListener listener, CfpCancellation cancellation) {
        CfpProgressListener progress = listener != null ? listener : CfpProgressListener.NOOP;
        CfpCancellation cancel = cancellation != null ? cancellation : new CfpCancellation();

        return Mono.defer(() -> {
            RunState state = new RunState(request, clock.millis());
            Duration timeout = effectiveTimeout(request.options());

            log.info(SEPARATOR);
            log.info("CFP run starting: url={} businessId={} timeout={}s",
                    request.url(), request.businessId(), timeout.toSeconds());
            log.info(SEPARATOR);

            Mono<CfpResult> failureFallback = Mono.defer(() -> {
                ProcessingError timedOut = new ProcessingError(
                        "CFP run timed out after " + timeout.toSeconds() + "s",
                        TIMED_OUT, false, context("cfp", state));
                return recordFailure(state, timedOut)
                        .then(Mono.fromSupplier(() -> finish(state, progress, timedOut)));
            });

            return runStages(state, progress, cancel)
                    .then(Mono.fromSupplier(() -> finish(state, progress, null)))
                    .onErrorResume(e -> recordFailure(state, e)
                            .then(Mono.fromSupplier(() -> finish(state, progress, e))))
                    .timeout(timeout, failureFallback);
        });
    }

    private Mono<Void> runStages(RunState state, CfpProgressListener progress, CfpCancellation cancel) {
        return Mono.defer(() -> resolveTarget(state))
                .then(Mono.defer(() -> checkCancelled(state, cancel)))
                .then(Mono.defer(() -> crawl(state, progress)))
                .then(Mono.defer(() -> checkCancelled(state, cancel)))
                .then(Mono.defer(() -> fingerprint(state, progress)))
                .then(Mono.defer(() -> checkCancelled(state, cancel)))
                .then(Mono.defer(() -> buildEntity(state, progress)))
                .then(Mono.defer(() -> checkCancelled(state, cancel)))
                .then(Mono.defer(() -> publish(state, progress)))
                .then(Mono.defer(() -> finalizeBusiness(state)));
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    private Mono<Void> resolveTarget(RunState state) {
        CfpRequest request = state.request;
        if (request.businessId() == null) {
            state.url = validateUrl(request.url(), context("cfp.validate-url", state));
            return Mono.empty();
        }

        Long businessId = request.businessId();
        ErrorContext ctx = ErrorContext.forBusiness("cfp.load-business", businessId);
        return retryExecutor.withRetry(
                        () -> blocking(() -> store.getBusinessById(businessId)),
                        ctx, retryProperties.forOperation(RetryProperties.DATABASE))
                .flatMap(found -> found.isPresent()
                        ? Mono.just(found.get())
                        : Mono.<Business>error(new ProcessingError(
                                "Business not found: " + businessId, ProcessingError.BUSINESS_NOT_FOUND, false, ctx)))
                .doOnNext(business -> {
                    state.business = business;
                    String url = request.url() != null ? request.url() : business.getUrl();
                    state.url = validateUrl(url, ctx.withUrl(url));
                })
                .then();
    }

    private Mono<Void> crawl(RunState state, CfpProgressListener progress) {
        notify(progress, CfpStage.CRAWLING, 10, "Crawling " + state.url);
        ErrorContext ctx = context("cfp.crawl", state);

        return startCrawlJob(state)
                .then(Mono.defer(() -> crawler.crawl(state.url)))
                .onErrorResume(e -> Mono.just(CrawlResult.failed(ErrorSanitizer.sanitize(e))))
                .defaultIfEmpty(CrawlResult.failed("Crawler returned no result"))
                .flatMap(result -> {
                    if (!result.success() || result.data() == null) {
                        String reason = result.error() != null ? result.error() : "no data extracted";
                        ParallelErrorDecision decision = PipelineErrorPolicy.handleParallelProcessingError(
                                new ProcessingError(reason, ProcessingError.CRAWL_FAILED, false, ctx), null, ctx);
                        notify(progress, CfpStage.CRAWLING, 40, "Crawl failed");
                        return Mono.<Void>error(new ProcessingError(String.join("; ", decision.errors()),
                                ProcessingError.CRAWL_FAILED, false, ctx));
                    }

                    state.crawlData = result.data();
                    state.crawlSuccess = true;
                    state.context = buildContext(state);
                    notify(progress, CfpStage.CRAWLING, 40, "Crawl completed for " + state.context.name());
                    return recordCrawlSuccess(state);
                });
    }

    private Mono<Void> fingerprint(RunState state, CfpProgressListener progress) {
        if (!state.request.options().isIncludeFingerprint()) {
            state.fingerprintSuccess = true;
            notify(progress, CfpStage.FINGERPRINTING, 60, "Fingerprint skipped");
            return Mono.empty();
        }

        ErrorContext ctx = context("cfp.fingerprint", state);
        return persist(state, "mark generating",
                        () -> store.updateBusiness(state.businessId(), BusinessPatch.ofStatus(BusinessStatus.GENERATING)))
                .then(Mono.defer(() -> fingerprinter.fingerprint(state.context)))
                .flatMap(analysis -> {
                    if (analysis.error() != null || analysis.successfulQueries() == 0) {
                        String reason = analysis.error() != null ? analysis.error() : "No LLM query succeeded";
                        return Mono.<Void>error(new ProcessingError(reason, ProcessingError.FINGERPRINT_FAILED, false, ctx));
                    }
                    state.fingerprint = analysis;
                    state.fingerprintSuccess = true;
                    notify(progress, CfpStage.FINGERPRINTING, 60,
                            "Fingerprint completed, visibility score " + analysis.visibilityScore());
                    return persist(state, "store fingerprint",
                            () -> store.createFingerprint(state.businessId(), analysis));
                })
                .onErrorResume(e -> {
                    ParallelErrorDecision decision = PipelineErrorPolicy.handleParallelProcessingError(null, e, ctx);
                    state.degradedMode = decision.degradedMode();
                    state.warnings.addAll(decision.errors());
                    notify(progress, CfpStage.FINGERPRINTING, 60, "Fingerprint failed, continuing without analysis");
                    return Mono.empty();
                });
    }

    private Mono<Void> buildEntity(RunState state, CfpProgressListener progress) {
        CfpOptions options = state.request.options();
        if (!options.isBuildEntity() && !options.isPublish()) {
            state.entityCreationSuccess = true;
            return Mono.empty();
        }

        notify(progress, CfpStage.CREATING_ENTITY, 70, "Building knowledge-base entity");
        return Mono.defer(() -> publisher.buildEntity(state.context, state.crawlData))
                .switchIfEmpty(Mono.error(new IllegalStateException("Publisher returned no entity")))
                .doOnNext(entity -> {
                    state.entity = entity;
                    state.entityCreationSuccess = true;
                    notify(progress, CfpStage.CREATING_ENTITY, 85, "Entity created: " + entity.label());
                })
                .then()
                .onErrorResume(e -> {
                    String message = "Entity creation failed: " + ErrorSanitizer.sanitize(e);
                    log.error("[{}] {}", state.url, message);
                    state.warnings.add(message);
                    notify(progress, CfpStage.CREATING_ENTITY, 85, "Entity creation failed");
                    return Mono.empty();
                });
    }

    private Mono<Void> publish(RunState state, CfpProgressListener progress) {
        CfpOptions options = state.request.options();
        if (!options.isPublish()) {
            state.publishSuccess = true;
            notify(progress, CfpStage.PUBLISHING, 100, "Publishing skipped");
            return Mono.empty();
        }
        if (state.entity == null) {
            state.warnings.add("Publish skipped: no entity was built");
            notify(progress, CfpStage.PUBLISHING, 100, "Publishing skipped, no entity");
            return Mono.empty();
        }

        boolean toProduction = options.getPublishToProduction() != null
                ? options.getPublishToProduction()
                : properties.isPublishToProduction();
        KnowledgeEntity entity = state.entity;

        return Mono.defer(() -> publisher.checkNotability(state.context.name(), state.context.location()))
                .flatMap(notability -> {
                    if (!notability.isNotable()) {
                        log.info("'{}' did not pass the notability check: {}",
                                state.context.name(), notability.reasons());
                        return Mono.just(PublishResult.failed(
                                "Business is not notable: " + String.join("; ", notability.reasons())));
                    }
                    log.info("Publishing '{}' to {} knowledge base", entity.label(), toProduction ? "production" : "test");
                    return publisher.publishEntity(entity, toProduction);
                })
                .onErrorResume(e -> Mono.just(PublishResult.failed("Publish failed: " + ErrorSanitizer.sanitize(e))))
                .defaultIfEmpty(PublishResult.failed("Publisher returned no result"))
                .doOnNext(result -> {
                    state.publishResult = result;
                    state.publishSuccess = result.success();
                    if (result.success()) {
                        notify(progress, CfpStage.PUBLISHING, 100, "Published as " + result.qid());
                    } else {
                        state.warnings.add(result.error() != null ? result.error() : "Publishing failed");
                        notify(progress, CfpStage.PUBLISHING, 100, "Publishing failed");
                    }
                })
                .then();
    }

    /**
     * Final status write, plus the next due date when the caller asked for one.
     */
    private Mono<Void> finalizeBusiness(RunState state) {
        if (state.business == null) {
            return Mono.empty();
        }
        Instant now = clock.instant();
        boolean published = state.publishResult != null && state.publishResult.success();

        BusinessPatch.BusinessPatchBuilder patch = BusinessPatch.builder()
                .status(published ? BusinessStatus.PUBLISHED : BusinessStatus.CRAWLED);
        if (published) {
            patch.wikidataQid(state.publishResult.qid()).publishedAt(now);
        }
        if (state.request.options().isScheduleNext()) {
            Tier tier = automationTiers.forPlan(state.business.getPlan());
            tier.getCrawlFrequency().nextRunAfter(now).ifPresent(next -> {
                patch.nextCrawlAt(next);
                log.info("Next automated run for business {} scheduled at {}", state.businessId(), next);
            });
        }
        return persist(state, "finalize status", () -> store.updateBusiness(state.businessId(), patch.build()));
    }

    private Mono<Void> checkCancelled(RunState state, CfpCancellation cancel) {
        if (cancel.isCancellationRequested()) {
            log.warn("CFP run for {} cancelled", state.url != null ? state.url : state.request.url());
            return Mono.error(new ProcessingError(CANCELLED_MESSAGE, CANCELLED, false, context("cfp", state)));
        }
        return Mono.empty();
    }

    // ------------------------------------------------------------------
    // Persistence, best effort
    // ------------------------------------------------------------------

    private Mono<Void> startCrawlJob(RunState state) {
        if (state.business == null) {
            return Mono.empty();
        }
        Long businessId = state.businessId();
        return blocking(() -> {
                    Long jobId = store.createCrawlJob(businessId, JOB_TYPE);
                    store.updateBusiness(businessId, BusinessPatch.ofStatus(BusinessStatus.CRAWLING));
                    return jobId;
                })
                .doOnNext(jobId -> state.jobId = jobId)
                .onErrorResume(e -> {
                    log.warn("Failed to start crawl job for business {}: {}", businessId, ErrorSanitizer.sanitize(e));
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Void> recordCrawlSuccess(RunState state) {
        return persist(state, "record crawl", () -> {
            store.updateBusiness(state.businessId(), BusinessPatch.builder()
                    .status(BusinessStatus.CRAWLED)
                    .crawlData(state.crawlData)
                    .lastCrawledAt(clock.instant())
                    .build());
            if (state.jobId != null) {
                store.updateCrawlJob(state.jobId, BusinessStore.JOB_COMPLETED, null);
                state.jobId = null;
            }
        });
    }

    private Mono<Void> recordFailure(RunState state, Throwable error) {
        String message = ErrorSanitizer.sanitize(error);
        return persist(state, "record failure", () -> {
            store.updateBusiness(state.businessId(), BusinessPatch.builder()
                    .status(BusinessStatus.ERROR)
                    .errorMessage(message)
                    .build());
            if (state.jobId != null) {
                store.updateCrawlJob(state.jobId, BusinessStore.JOB_FAILED, message);
                state.jobId = null;
            }
        });
    }

    private Mono<Void> persist(RunState state, String action, Runnable write) {
        if (state.business == null) {
            return Mono.empty();
        }
        return Mono.<Void>fromRunnable(write)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("Failed to {} for business {}: {}", action, state.businessId(), ErrorSanitizer.sanitize(e));
                    return Mono.empty();
                });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ------------------------------------------------------------------
    // Result
    // ------------------------------------------------------------------

    private CfpResult finish(RunState state, CfpProgressListener progress, Throwable error) {
        CfpOptions options = state.request.options();
        boolean fingerprintRequired = options.getRequireFingerprint() != null
                ? options.getRequireFingerprint()
                : properties.isRequireFingerprint();

        boolean success = error == null
                && state.crawlSuccess
                && (state.fingerprintSuccess || !fingerprintRequired)
                && state.entityCreationSuccess
                && state.publishSuccess;

        String errorMessage = null;
        if (error != null) {
            errorMessage = ErrorSanitizer.sanitize(error);
        } else if (!success && !state.warnings.isEmpty()) {
            errorMessage = String.join("; ", state.warnings);
        }

        PartialResults partial = new PartialResults(
                state.crawlSuccess, state.fingerprintSuccess, state.entityCreationSuccess, state.publishSuccess);
        long elapsed = clock.millis() - state.startedAt;

        CfpResult result = new CfpResult(
                success,
                state.url != null ? state.url : state.request.url(),
                state.context,
                state.crawlData,
                state.fingerprint,
                state.entity,
                state.publishResult,
                state.degradedMode,
                elapsed,
                clock.instant(),
                errorMessage,
                partial);

        String outcome;
        if (success) {
            outcome = "success";
        } else if (partial.anySuccess()) {
            outcome = "partial";
        } else {
            outcome = "failed";
        }
        metrics.recordCfpRun(outcome);

        if (success) {
            notify(progress, CfpStage.COMPLETED, 100, "CFP run completed");
        } else {
            notify(progress, CfpStage.FAILED, 100, errorMessage != null ? errorMessage : "CFP run failed");
        }

        log.info(SEPARATOR);
        log.info("CFP SUMMARY: {} in {}ms", outcome.toUpperCase(Locale.ROOT), elapsed);
        log.info("  URL: {}", result.url());
        log.info("  Stages: crawl={} fingerprint={} entity={} publish={} degraded={}",
                partial.crawlSuccess(), partial.fingerprintSuccess(),
                partial.entityCreationSuccess(), partial.publishSuccess(), state.degradedMode);
        if (errorMessage != null) {
            log.info("  Error: {}", errorMessage);
        }
        log.info(SEPARATOR);
        return result;
    }

    private void notify(CfpProgressListener progress, CfpStage stage, int percent, String message) {
        log.info("CFP progress: {} ({}%) {}", stage.value(), percent, message);
        try {
            progress.onStageTransition(stage, percent, message);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at stage {}: {}", stage.value(), ErrorSanitizer.sanitize(e));
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    Duration effectiveTimeout(CfpOptions options) {
        Duration requested = options.getTimeout();
        Duration timeout = requested != null && !requested.isZero() && !requested.isNegative()
                ? requested
                : properties.getDefaultTimeout();
        return timeout.compareTo(properties.getMaxTimeout()) > 0 ? properties.getMaxTimeout() : timeout;
    }

    private BusinessContext buildContext(RunState state) {
        CrawlData data = state.crawlData;
        Business business = state.business;

        String name = firstNonBlank(
                business != null ? business.getName() : null,
                data != null ? data.name() : null,
                extractBusinessNameFromUrl(state.url));
        String category = firstNonBlank(
                business != null ? business.getCategory() : null,
                data != null ? data.category() : null,
                DEFAULT_CATEGORY);

        Location location = business != null ? business.getLocation() : null;
        if (!hasLocation(location) && data != null) {
            location = data.location();
        }
        return new BusinessContext(state.businessId(), name, state.url, category, location, data);
    }

    private static boolean hasLocation(Location location) {
        return location != null && !location.display().isEmpty();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static ErrorContext context(String operation, RunState state) {
        ErrorContext ctx = ErrorContext.forBusiness(operation, state.request.businessId());
        String url = state.url != null ? state.url : state.request.url();
        return url != null ? ctx.withUrl(url) : ctx;
    }

    /**
     * Accept absolute http(s) URLs with a host.
     *
     * @return the trimmed URL
     */
    static String validateUrl(String url, ErrorContext ctx) {
        if (url == null || url.isBlank()) {
            throw new ProcessingError("Invalid URL format: " + url, ProcessingError.INVALID_URL, false, ctx);
        }
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ProcessingError("Only HTTP and HTTPS URLs are supported: " + trimmed,
                        ProcessingError.INVALID_URL, false, ctx);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ProcessingError("Invalid URL format: " + trimmed, ProcessingError.INVALID_URL, false, ctx);
            }
            return trimmed;
        } catch (URISyntaxException e) {
            throw new ProcessingError("Invalid URL format: " + trimmed, ProcessingError.INVALID_URL, false, ctx, e);
        }
    }

    /**
     * Guess a display name from the first host label, e.g. {@code https://www.acme-plumbing.com}
     * gives "Acme Plumbing".
     */
    public static String extractBusinessNameFromUrl(String url) {
        if (url == null || url.isBlank()) {
            return UNKNOWN_BUSINESS;
        }
        String host;
        try {
            host = new URI(url.trim()).getHost();
        } catch (URISyntaxException e) {
            log.debug("Cannot derive a business name from '{}': {}", url, ErrorSanitizer.sanitize(e));
            return UNKNOWN_BUSINESS;
        }
        if (host == null || host.isBlank()) {
            return UNKNOWN_BUSINESS;
        }

        host = host.toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        String label = host.split("\\.")[0];
        String name = Arrays.stream(label.split("-"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
        return name.isEmpty() ? UNKNOWN_BUSINESS : name;
    }

    /**
     * Mutable state of one run, read by the timeout fallback to build the best partial result.
     */
    private static final class RunState {
        private final CfpRequest request;
        private final long startedAt;
        private final List<String> warnings = new CopyOnWriteArrayList<>();

        private volatile String url;
        private volatile Business business;
        private volatile Long jobId;
        private volatile BusinessContext context;
        private volatile CrawlData crawlData;
        private volatile FingerprintAnalysis fingerprint;
        private volatile KnowledgeEntity entity;
        private volatile PublishResult publishResult;
        private volatile boolean crawlSuccess;
        private volatile boolean fingerprintSuccess;
        private volatile boolean entityCreationSuccess;
        private volatile boolean publishSuccess;
        private volatile boolean degradedMode;

        private RunState(CfpRequest request, long startedAt) {
            this.request = request;
            this.startedAt = startedAt;
        }

        private Long businessId() {
            return business != null ? business.getId() : request.businessId();
        }
    }
}
