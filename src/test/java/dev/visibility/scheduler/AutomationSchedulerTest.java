package dev.visibility.scheduler;

import dev.visibility.cfp.CfpOrchestrator;
import dev.visibility.cfp.CfpRequest;
import dev.visibility.cfp.CfpResult;
import dev.visibility.cfp.PartialResults;
import dev.visibility.config.AutomationProperties;
import dev.visibility.llm.ResponseCache;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.model.Business;
import dev.visibility.service.BusinessStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AutomationSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-06-02T00:00:00Z");
    private static final Instant STALE_BEFORE = NOW.minus(Duration.ofDays(7));

    @Mock
    private BusinessStore store;

    @Mock
    private CfpOrchestrator orchestrator;

    @Mock
    private ResponseCache responseCache;

    private SimpleMeterRegistry registry;
    private AutomationProperties properties;
    private AutomationScheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new AutomationProperties();
        scheduler = new AutomationScheduler(store, orchestrator, new AutomationTiers(properties), properties,
                responseCache, new VisibilityMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Business business(long id, String plan, Instant nextCrawlAt) {
        return Business.builder()
                .id(id)
                .name("Business " + id)
                .url("https://business" + id + ".example")
                .plan(plan)
                .automationEnabled(true)
                .nextCrawlAt(nextCrawlAt)
                .build();
    }

    private static CfpResult result(boolean success, String error) {
        return new CfpResult(success, "https://example.com", null, null, null, null, null, false, 10, NOW, error,
                new PartialResults(success, success, success, success));
    }

    @Test
    @DisplayName("Should process exactly one batch and defer the rest")
    void shouldProcessOneBatch() {
        List<Business> candidates = new ArrayList<>(LongStream.rangeClosed(1, 15)
                .mapToObj(id -> business(id, "pro", null))
                .toList());
        when(store.findAutomationCandidates(NOW, STALE_BEFORE)).thenReturn(candidates);
        when(orchestrator.execute(any(CfpRequest.class))).thenReturn(Mono.just(result(true, null)));

        StepVerifier.create(scheduler.processScheduledAutomation(10, true))
                .assertNext(summary -> {
                    assertThat(summary.due()).isEqualTo(15);
                    assertThat(summary.processed()).isEqualTo(10);
                    assertThat(summary.succeeded()).isEqualTo(10);
                    assertThat(summary.deferred()).isEqualTo(5);
                })
                .verifyComplete();

        ArgumentCaptor<CfpRequest> requests = ArgumentCaptor.forClass(CfpRequest.class);
        verify(orchestrator, times(10)).execute(requests.capture());
        assertThat(requests.getAllValues()).extracting(CfpRequest::businessId)
                .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L);
        assertThat(requests.getValue().options().isPublish()).isTrue();
        assertThat(requests.getValue().options().isScheduleNext()).isTrue();
        assertThat(registry.counter("visibility_scheduler_businesses_processed_total").count()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should record skipped businesses and still run long-overdue ones")
    void shouldRecordSkipped() {
        when(store.findAutomationCandidates(NOW)).thenReturn(List.of(
                business(1L, "free", null),
                business(2L, "pro", NOW.plus(Duration.ofDays(1))),
                business(3L, "pro", NOW.minus(Duration.ofDays(30))),
                business(4L, "pro", NOW.minus(Duration.ofHours(1)))));
        when(orchestrator.execute(any(CfpRequest.class))).thenReturn(Mono.just(result(true, null)));

        StepVerifier.create(scheduler.processScheduledAutomation(10, false))
                .assertNext(summary -> {
                    assertThat(summary.due()).isEqualTo(2);
                    assertThat(summary.processed()).isEqualTo(2);
                    assertThat(summary.skipped()).isEqualTo(2);
                    assertThat(summary.outcomes())
                            .filteredOn(o -> o.status() == BusinessOutcome.Status.SKIPPED)
                            .extracting(BusinessOutcome::error)
                            .containsExactly("plan has manual crawl frequency", "not yet due");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should catch up stale businesses scheduled in the future")
    void shouldCatchUpStaleBusinesses() {
        Business neverCrawled = business(5L, "pro", NOW.plus(Duration.ofDays(2)));
        Business recent = business(6L, "pro", NOW.plus(Duration.ofDays(5)));
        recent.setLastCrawledAt(NOW.minus(Duration.ofDays(2)));
        when(store.findAutomationCandidates(NOW, STALE_BEFORE)).thenReturn(List.of(neverCrawled, recent));
        when(orchestrator.execute(any(CfpRequest.class))).thenReturn(Mono.just(result(true, null)));

        StepVerifier.create(scheduler.processScheduledAutomation(10, true))
                .assertNext(summary -> {
                    assertThat(summary.processed()).isEqualTo(1);
                    assertThat(summary.skipped()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<CfpRequest> request = ArgumentCaptor.forClass(CfpRequest.class);
        verify(orchestrator).execute(request.capture());
        assertThat(request.getValue().businessId()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should keep going after individual failures")
    void shouldIsolateFailures() {
        when(store.findAutomationCandidates(NOW, STALE_BEFORE)).thenReturn(List.of(
                business(1L, "pro", null), business(2L, "pro", null), business(3L, "pro", null)));
        when(orchestrator.execute(any(CfpRequest.class)))
                .thenReturn(Mono.just(result(false, "Crawl failed: 503")))
                .thenReturn(Mono.error(new IllegalStateException("orchestrator crashed")))
                .thenReturn(Mono.just(result(true, null)));

        StepVerifier.create(scheduler.processScheduledAutomation(10, true))
                .assertNext(summary -> {
                    assertThat(summary.processed()).isEqualTo(3);
                    assertThat(summary.succeeded()).isEqualTo(1);
                    assertThat(summary.failed()).isEqualTo(2);
                    assertThat(summary.outcomes()).extracting(BusinessOutcome::error)
                            .containsExactly("Crawl failed: 503", "orchestrator crashed", null);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should do nothing when no business is due")
    void shouldHandleEmptyPass() {
        when(store.findAutomationCandidates(NOW, STALE_BEFORE)).thenReturn(List.of());

        StepVerifier.create(scheduler.processScheduledAutomation())
                .assertNext(summary -> assertThat(summary).isEqualTo(SchedulerRunSummary.empty()))
                .verifyComplete();

        verify(orchestrator, never()).execute(any(CfpRequest.class));
    }

    @Test
    @DisplayName("Should evict expired cache entries before a cron pass")
    void shouldEvictCacheOnScheduledPass() {
        when(store.findAutomationCandidates(NOW, STALE_BEFORE)).thenReturn(List.of());

        scheduler.runScheduledPass();

        verify(responseCache).evictExpired();
    }
}
