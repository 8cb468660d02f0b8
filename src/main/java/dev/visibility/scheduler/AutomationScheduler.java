package dev.visibility.scheduler;

import dev.visibility.cfp.CfpOptions;
import dev.visibility.cfp.CfpOrchestrator;
import dev.visibility.cfp.CfpRequest;
import dev.visibility.config.AutomationProperties;
import dev.visibility.config.AutomationProperties.Tier;
import dev.visibility.llm.ResponseCache;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.model.Business;
import dev.visibility.retry.ErrorSanitizer;
import dev.visibility.service.BusinessStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds businesses due for automated processing and runs the CFP pipeline for them,
 * one at a time and at most one batch per pass.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationScheduler {

    private static final String SEPARATOR = "========================================";

    private final BusinessStore store;
    private final CfpOrchestrator orchestrator;
    private final AutomationTiers tiers;
    private final AutomationProperties properties;
    private final ResponseCache responseCache;
    private final VisibilityMetrics metrics;
    private final Clock clock;

    /**
     * Cron entry point, active only when scheduling is enabled.
     */
    @Scheduled(cron = "${automation.scheduling.cron:0 0 * * * *}")
    public void runScheduledPass() {
        int evicted = responseCache.evictExpired();
        if (evicted > 0) {
            log.debug("Evicted {} expired cached LLM responses", evicted);
        }
        SchedulerRunSummary summary = processScheduledAutomation().block();
        if (summary != null) {
            log.info("Scheduled pass finished: processed={} succeeded={} failed={} deferred={}",
                    summary.processed(), summary.succeeded(), summary.failed(), summary.deferred());
        }
    }

    public Mono<SchedulerRunSummary> processScheduledAutomation() {
        return processScheduledAutomation(properties.getBatchSize(), properties.isCatchMissed());
    }

    public Mono<SchedulerRunSummary> processScheduledAutomation(int batchSize, boolean catchMissed) {
        int limit = batchSize > 0 ? batchSize : properties.getBatchSize();
        Instant now = clock.instant();

        log.info(SEPARATOR);
        log.info("Scheduled automation pass starting (batchSize={}, catchMissed={})", limit, catchMissed);
        log.info(SEPARATOR);

        return Mono.fromCallable(() -> loadCandidates(now, catchMissed))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(candidates -> {
                    List<BusinessOutcome> outcomes = new ArrayList<>();
                    List<Business> due = new ArrayList<>();
                    for (Business business : candidates) {
                        Tier tier = tiers.forPlan(business.getPlan());
                        if (SchedulePolicy.isDue(business, tier, now, catchMissed)) {
                            if (SchedulePolicy.isMissed(business, tier, now)) {
                                log.info("Business {} missed its schedule (next crawl was {}), catching up",
                                        business.getId(), business.getNextCrawlAt());
                            }
                            due.add(business);
                        } else {
                            String reason = skipReason(business, tier, now);
                            log.debug("Skipping business {} ({}): {}", business.getId(), business.getName(), reason);
                            outcomes.add(BusinessOutcome.skipped(business.getId(), business.getName(), reason));
                        }
                    }

                    List<Business> batch = due.subList(0, Math.min(limit, due.size()));
                    int deferred = due.size() - batch.size();
                    log.info("Found {} businesses due for processing, processing {}", due.size(), batch.size());
                    if (deferred > 0) {
                        log.info("Deferring {} due businesses to the next pass: {}", deferred,
                                due.subList(batch.size(), due.size()).stream().map(Business::getId).toList());
                    }

                    return Flux.fromIterable(batch)
                            .concatMap(this::processBusiness)
                            .collectList()
                            .map(processed -> summarize(due.size(), deferred, outcomes, processed));
                })
                .doOnNext(summary -> metrics.updateLastSchedulerRun(summary.due(), summary.processed()));
    }

    private List<Business> loadCandidates(Instant now, boolean catchMissed) {
        if (!catchMissed) {
            return store.findAutomationCandidates(now);
        }
        return tiers.shortestCycle()
                .map(cycle -> store.findAutomationCandidates(now, now.minus(cycle)))
                .orElseGet(() -> store.findAutomationCandidates(now));
    }

    private Mono<BusinessOutcome> processBusiness(Business business) {
        Tier tier = tiers.forPlan(business.getPlan());
        log.info("Processing business {} ('{}') plan={} frequency={}",
                business.getId(), business.getName(), business.getPlan(), tier.getCrawlFrequency());

        CfpOptions options = CfpOptions.builder()
                .publish(tier.isAutoPublish())
                .scheduleNext(true)
                .build();

        return orchestrator.execute(CfpRequest.forBusiness(business.getId(), options))
                .map(result -> result.success()
                        ? BusinessOutcome.success(business.getId(), business.getName())
                        : BusinessOutcome.failed(business.getId(), business.getName(), result.error()))
                .onErrorResume(e -> Mono.just(BusinessOutcome.failed(
                        business.getId(), business.getName(), ErrorSanitizer.sanitize(e))))
                .doOnNext(outcome -> {
                    metrics.recordBusinessProcessed(outcome.status().name().toLowerCase(Locale.ROOT));
                    if (outcome.status() == BusinessOutcome.Status.SUCCESS) {
                        log.info("Business {} automation completed", business.getId());
                    } else {
                        log.error("Business {} automation failed: {}", business.getId(), outcome.error());
                    }
                });
    }

    private SchedulerRunSummary summarize(int due, int deferred, List<BusinessOutcome> skipped,
                                          List<BusinessOutcome> processed) {
        int succeeded = (int) processed.stream()
                .filter(o -> o.status() == BusinessOutcome.Status.SUCCESS)
                .count();
        List<BusinessOutcome> all = new ArrayList<>(processed);
        all.addAll(skipped);

        SchedulerRunSummary summary = new SchedulerRunSummary(
                due, processed.size(), succeeded, processed.size() - succeeded, deferred, all);

        log.info(SEPARATOR);
        log.info("AUTOMATION SUMMARY: due={} processed={} succeeded={} failed={} deferred={} skipped={}",
                summary.due(), summary.processed(), summary.succeeded(), summary.failed(),
                summary.deferred(), summary.skipped());
        log.info(SEPARATOR);
        return summary;
    }

    private static String skipReason(Business business, Tier tier, Instant now) {
        if (!business.isAutomationEnabled()) {
            return "automation disabled";
        }
        if (tier.getCrawlFrequency() == null || !tier.getCrawlFrequency().isAutomatic()) {
            return "plan has manual crawl frequency";
        }
        return "not yet due";
    }
}
