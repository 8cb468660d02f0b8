package dev.visibility.cfp;

import dev.visibility.config.AutomationProperties;
import dev.visibility.config.CfpProperties;
import dev.visibility.config.RetryProperties;
import dev.visibility.crawl.WebsiteCrawler;
import dev.visibility.fingerprint.BusinessFingerprinter;
import dev.visibility.fingerprint.CompetitiveLeaderboard;
import dev.visibility.fingerprint.FingerprintAnalysis;
import dev.visibility.metrics.VisibilityMetrics;
import dev.visibility.model.Business;
import dev.visibility.model.BusinessContext;
import dev.visibility.model.BusinessPatch;
import dev.visibility.model.BusinessStatus;
import dev.visibility.model.CrawlData;
import dev.visibility.model.CrawlResult;
import dev.visibility.publish.KnowledgeBasePublisher;
import dev.visibility.publish.KnowledgeEntity;
import dev.visibility.publish.NotabilityResult;
import dev.visibility.publish.PublishResult;
import dev.visibility.retry.RetryExecutor;
import dev.visibility.scheduler.AutomationTiers;
import dev.visibility.service.BusinessStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
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
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CfpOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-04-01T09:00:00Z");
    private static final String URL = "https://www.acme-plumbing.com";

    @Mock
    private WebsiteCrawler crawler;

    @Mock
    private BusinessFingerprinter fingerprinter;

    @Mock
    private KnowledgeBasePublisher publisher;

    @Mock
    private BusinessStore store;

    private SimpleMeterRegistry registry;
    private CfpProperties properties;
    private CfpOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new CfpProperties();
        orchestrator = new CfpOrchestrator(crawler, fingerprinter, publisher, store,
                new AutomationTiers(new AutomationProperties()), new RetryExecutor(), new RetryProperties(),
                properties, new VisibilityMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CrawlData crawlData() {
        return CrawlData.builder()
                .name("Acme Plumbing")
                .description("Emergency plumbing in Denver")
                .crawledAt(NOW)
                .build();
    }

    private static FingerprintAnalysis analysis(int successful, String error) {
        return new FingerprintAnalysis(7L, "Acme Plumbing", successful > 0 ? 72 : 0, 0.67, 1.0, 0.8, 1.5,
                9, successful, CompetitiveLeaderboard.empty("Acme Plumbing"), List.of(), NOW, 1200, error);
    }

    private void crawlSucceeds() {
        when(crawler.crawl(any())).thenReturn(Mono.just(CrawlResult.success(crawlData())));
    }

    private void fingerprintSucceeds() {
        when(fingerprinter.fingerprint(any())).thenReturn(Mono.just(analysis(9, null)));
    }

    private void entityBuilds() {
        when(publisher.buildEntity(any(), any()))
                .thenReturn(Mono.just(new KnowledgeEntity("Acme Plumbing", "Plumber", Map.of(), null)));
    }

    private double cfpRuns(String outcome) {
        return registry.counter("visibility_cfp_runs_total", "outcome", outcome).count();
    }

    @Nested
    @DisplayName("URL runs")
    class UrlRuns {

        @Test
        @DisplayName("Should run every requested stage and report progress in order")
        void shouldCompleteHappyPath() {
            crawlSucceeds();
            fingerprintSucceeds();
            entityBuilds();
            List<CfpStage> stages = new ArrayList<>();

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL),
                            (stage, percent, message) -> stages.add(stage), new CfpCancellation()))
                    .assertNext(result -> {
                        assertThat(result.success()).isTrue();
                        assertThat(result.error()).isNull();
                        assertThat(result.business().name()).isEqualTo("Acme Plumbing");
                        assertThat(result.fingerprint().visibilityScore()).isEqualTo(72);
                        assertThat(result.entity().label()).isEqualTo("Acme Plumbing");
                        assertThat(result.publishResult()).isNull();
                        assertThat(result.partialResults()).isEqualTo(new PartialResults(true, true, true, true));
                        assertThat(result.timestamp()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            assertThat(stages).containsSubsequence(
                    CfpStage.CRAWLING, CfpStage.FINGERPRINTING, CfpStage.CREATING_ENTITY, CfpStage.PUBLISHING);
            assertThat(stages.get(stages.size() - 1)).isEqualTo(CfpStage.COMPLETED);
            assertThat(cfpRuns("success")).isEqualTo(1.0);
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("Should reject a non-http URL before crawling")
        void shouldRejectInvalidUrl() {
            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl("ftp://files.example.com")))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.error()).contains("Only HTTP and HTTPS URLs are supported");
                        assertThat(result.partialResults()).isEqualTo(PartialResults.none());
                    })
                    .verifyComplete();

            verifyNoInteractions(crawler, fingerprinter, publisher);
            assertThat(cfpRuns("failed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should halt when the crawl fails")
        void shouldHaltOnCrawlFailure() {
            when(crawler.crawl(any())).thenReturn(Mono.just(CrawlResult.failed("Crawl request failed with status 404")));

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL)))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.error()).isEqualTo("Crawl failed: Crawl request failed with status 404");
                        assertThat(result.partialResults().crawlSuccess()).isFalse();
                        assertThat(result.crawlData()).isNull();
                    })
                    .verifyComplete();

            verifyNoInteractions(fingerprinter, publisher);
        }

        @Test
        @DisplayName("Should continue in degraded mode when fingerprinting fails")
        void shouldDegradeOnFingerprintFailure() {
            crawlSucceeds();
            entityBuilds();
            when(fingerprinter.fingerprint(any())).thenReturn(Mono.just(analysis(0, null)));

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL)))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.degradedMode()).isTrue();
                        assertThat(result.fingerprint()).isNull();
                        assertThat(result.entity()).isNotNull();
                        assertThat(result.error()).contains("Fingerprint failed");
                        assertThat(result.partialResults()).isEqualTo(new PartialResults(true, false, true, true));
                    })
                    .verifyComplete();

            assertThat(cfpRuns("partial")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should succeed without a fingerprint when it is not required")
        void shouldTolerateMissingFingerprintWhenOptional() {
            crawlSucceeds();
            entityBuilds();
            when(fingerprinter.fingerprint(any())).thenReturn(Mono.error(new IllegalStateException("all models down")));
            CfpOptions options = CfpOptions.builder().requireFingerprint(false).build();

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL, options)))
                    .assertNext(result -> {
                        assertThat(result.success()).isTrue();
                        assertThat(result.degradedMode()).isTrue();
                        assertThat(result.partialResults().fingerprintSuccess()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should skip fingerprinting and entity building when not requested")
        void shouldSkipOptionalStages() {
            crawlSucceeds();
            CfpOptions options = CfpOptions.builder().includeFingerprint(false).buildEntity(false).build();

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL, options)))
                    .assertNext(result -> {
                        assertThat(result.success()).isTrue();
                        assertThat(result.fingerprint()).isNull();
                        assertThat(result.entity()).isNull();
                        assertThat(result.partialResults()).isEqualTo(new PartialResults(true, true, true, true));
                    })
                    .verifyComplete();

            verifyNoInteractions(fingerprinter, publisher);
        }
    }

    @Nested
    @DisplayName("publishing")
    class Publishing {

        private final CfpOptions publish = CfpOptions.builder().publish(true).build();

        @Test
        @DisplayName("Should not publish a business that fails the notability check")
        void shouldStopAtNotabilityGate() {
            crawlSucceeds();
            fingerprintSucceeds();
            entityBuilds();
            when(publisher.checkNotability(eq("Acme Plumbing"), any()))
                    .thenReturn(Mono.just(new NotabilityResult(false, 0.2, List.of("No independent references"), null)));

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL, publish)))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.publishResult().success()).isFalse();
                        assertThat(result.error()).isEqualTo("Business is not notable: No independent references");
                        assertThat(result.partialResults().publishSuccess()).isFalse();
                    })
                    .verifyComplete();

            verify(publisher, never()).publishEntity(any(), anyBoolean());
        }

        @Test
        @DisplayName("Should publish a notable business to the configured target")
        void shouldPublishNotableBusiness() {
            crawlSucceeds();
            fingerprintSucceeds();
            entityBuilds();
            when(publisher.checkNotability(any(), any()))
                    .thenReturn(Mono.just(new NotabilityResult(true, 0.9, List.of(), List.of("https://news.example"))));
            when(publisher.publishEntity(any(), eq(false))).thenReturn(Mono.just(PublishResult.published("Q4242")));

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL, publish)))
                    .assertNext(result -> {
                        assertThat(result.success()).isTrue();
                        assertThat(result.publishResult().qid()).isEqualTo("Q4242");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("cancellation and timeout")
    class CancellationAndTimeout {

        @Test
        @DisplayName("Should stop at the next stage boundary once cancelled")
        void shouldStopWhenCancelled() {
            crawlSucceeds();
            CfpCancellation cancellation = new CfpCancellation();
            CfpProgressListener cancelAfterCrawl = (stage, percent, message) -> {
                if (stage == CfpStage.CRAWLING && percent == 40) {
                    cancellation.cancel();
                }
            };

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL), cancelAfterCrawl, cancellation))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.error()).isEqualTo(CfpOrchestrator.CANCELLED_MESSAGE);
                        assertThat(result.partialResults().crawlSuccess()).isTrue();
                        assertThat(result.crawlData()).isNotNull();
                    })
                    .verifyComplete();

            verifyNoInteractions(fingerprinter);
        }

        @Test
        @DisplayName("Should return the partial state when the run exceeds its timeout")
        void shouldTimeOut() {
            when(crawler.crawl(any())).thenReturn(Mono.never());
            CfpOptions options = CfpOptions.builder().timeout(Duration.ofSeconds(1)).build();

            StepVerifier.create(orchestrator.execute(CfpRequest.forUrl(URL, options)))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.error()).isEqualTo("CFP run timed out after 1s");
                        assertThat(result.url()).isEqualTo(URL);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should cap requested timeouts at the configured maximum")
        void shouldCapTimeout() {
            assertThat(orchestrator.effectiveTimeout(CfpOptions.defaults())).isEqualTo(Duration.ofSeconds(60));
            assertThat(orchestrator.effectiveTimeout(CfpOptions.builder().timeout(Duration.ofSeconds(10)).build()))
                    .isEqualTo(Duration.ofSeconds(10));
            assertThat(orchestrator.effectiveTimeout(CfpOptions.builder().timeout(Duration.ofMinutes(10)).build()))
                    .isEqualTo(Duration.ofMinutes(2));
        }
    }

    @Nested
    @DisplayName("stored businesses")
    class StoredBusinesses {

        private final Business business = Business.builder()
                .id(7L)
                .name("Acme Co")
                .url("https://acme.example")
                .plan("pro")
                .automationEnabled(true)
                .status(BusinessStatus.PENDING)
                .build();

        @Test
        @DisplayName("Should walk the business through its statuses and schedule the next run")
        void shouldUpdateBusinessThroughRun() {
            when(store.getBusinessById(7L)).thenReturn(Optional.of(business));
            when(store.createCrawlJob(7L, "cfp")).thenReturn(99L);
            crawlSucceeds();
            fingerprintSucceeds();
            entityBuilds();
            CfpOptions options = CfpOptions.builder().scheduleNext(true).build();

            StepVerifier.create(orchestrator.execute(CfpRequest.forBusiness(7L, options)))
                    .assertNext(result -> {
                        assertThat(result.success()).isTrue();
                        assertThat(result.url()).isEqualTo("https://acme.example");
                        BusinessContext context = result.business();
                        assertThat(context.name()).isEqualTo("Acme Co");
                        assertThat(context.businessId()).isEqualTo(7L);
                    })
                    .verifyComplete();

            ArgumentCaptor<BusinessPatch> patches = ArgumentCaptor.forClass(BusinessPatch.class);
            verify(store, times(4)).updateBusiness(eq(7L), patches.capture());
            assertThat(patches.getAllValues()).extracting(BusinessPatch::status).containsExactly(
                    BusinessStatus.CRAWLING, BusinessStatus.CRAWLED, BusinessStatus.GENERATING, BusinessStatus.CRAWLED);
            assertThat(patches.getAllValues().get(1).crawlData()).isNotNull();
            assertThat(patches.getAllValues().get(3).nextCrawlAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
            verify(store).updateCrawlJob(99L, BusinessStore.JOB_COMPLETED, null);
            verify(store).createFingerprint(eq(7L), any(FingerprintAnalysis.class));
        }

        @Test
        @DisplayName("Should still schedule the next run when only publishing fails")
        void shouldScheduleNextRunAfterFailedPublish() {
            when(store.getBusinessById(7L)).thenReturn(Optional.of(business));
            when(store.createCrawlJob(7L, "cfp")).thenReturn(99L);
            crawlSucceeds();
            fingerprintSucceeds();
            entityBuilds();
            when(publisher.checkNotability(any(), any()))
                    .thenReturn(Mono.just(new NotabilityResult(false, 0.1, List.of("No independent references"), null)));
            CfpOptions options = CfpOptions.builder().publish(true).scheduleNext(true).build();

            StepVerifier.create(orchestrator.execute(CfpRequest.forBusiness(7L, options)))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.partialResults().crawlSuccess()).isTrue();
                    })
                    .verifyComplete();

            ArgumentCaptor<BusinessPatch> patches = ArgumentCaptor.forClass(BusinessPatch.class);
            verify(store, atLeastOnce()).updateBusiness(eq(7L), patches.capture());
            BusinessPatch last = patches.getValue();
            assertThat(last.status()).isEqualTo(BusinessStatus.CRAWLED);
            assertThat(last.nextCrawlAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("Should mark the business and its job as failed when the crawl fails")
        void shouldRecordCrawlFailure() {
            when(store.getBusinessById(7L)).thenReturn(Optional.of(business));
            when(store.createCrawlJob(7L, "cfp")).thenReturn(99L);
            when(crawler.crawl("https://acme.example")).thenReturn(Mono.just(CrawlResult.failed("Crawl timeout after 30000ms")));

            StepVerifier.create(orchestrator.execute(CfpRequest.forBusiness(7L, CfpOptions.defaults())))
                    .assertNext(result -> assertThat(result.success()).isFalse())
                    .verifyComplete();

            ArgumentCaptor<BusinessPatch> patches = ArgumentCaptor.forClass(BusinessPatch.class);
            verify(store, times(2)).updateBusiness(eq(7L), patches.capture());
            BusinessPatch last = patches.getAllValues().get(1);
            assertThat(last.status()).isEqualTo(BusinessStatus.ERROR);
            assertThat(last.errorMessage()).contains("Crawl timeout");
            verify(store).updateCrawlJob(eq(99L), eq(BusinessStore.JOB_FAILED), startsWith("Crawl failed"));
        }

        @Test
        @DisplayName("Should fail cleanly for an unknown business id")
        void shouldFailForUnknownBusiness() {
            when(store.getBusinessById(404L)).thenReturn(Optional.empty());

            StepVerifier.create(orchestrator.execute(CfpRequest.forBusiness(404L, CfpOptions.defaults())))
                    .assertNext(result -> {
                        assertThat(result.success()).isFalse();
                        assertThat(result.error()).isEqualTo("Business not found: 404");
                    })
                    .verifyComplete();

            verifyNoInteractions(crawler);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "https://www.acme-plumbing.com, Acme Plumbing",
            "http://bluedoor.example.org/menu, Bluedoor",
            "https://smith--sons.co.uk, Smith Sons",
            "not a url, Unknown Business",
            "'', Unknown Business"
    })
    @DisplayName("Should derive a display name from the host")
    void shouldExtractBusinessNameFromUrl(String url, String expected) {
        assertThat(CfpOrchestrator.extractBusinessNameFromUrl(url)).isEqualTo(expected);
    }
}
