package dev.visibility.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.visibility.entity.BusinessEntity;
import dev.visibility.entity.CrawlJobEntity;
import dev.visibility.entity.FingerprintEntity;
import dev.visibility.fingerprint.FingerprintAnalysis;
import dev.visibility.model.Business;
import dev.visibility.model.BusinessPatch;
import dev.visibility.model.CrawlData;
import dev.visibility.model.Location;
import dev.visibility.repository.BusinessRepository;
import dev.visibility.repository.CrawlJobRepository;
import dev.visibility.repository.FingerprintRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * BusinessStore backed by Spring Data JPA. Timestamps are stored as UTC local date-times.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaBusinessStore implements BusinessStore {

    private final BusinessRepository businessRepository;
    private final FingerprintRepository fingerprintRepository;
    private final CrawlJobRepository crawlJobRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Business> getBusinessById(Long id) {
        return businessRepository.findById(id).map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Business> findAutomationCandidates(Instant now) {
        return businessRepository.findAutomationCandidates(toLocal(now)).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Business> findAutomationCandidates(Instant now, Instant staleBefore) {
        return businessRepository.findAutomationCandidatesIncludingStale(toLocal(now), toLocal(staleBefore)).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    @Transactional
    public Business updateBusiness(Long id, BusinessPatch patch) {
        BusinessEntity entity = businessRepository.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Business not found: " + id));

        if (patch.name() != null) {
            entity.setName(patch.name());
        }
        if (patch.status() != null) {
            entity.setStatus(patch.status());
        }
        if (patch.crawlData() != null) {
            entity.setCrawlDataJson(writeJson(patch.crawlData()));
        }
        if (patch.lastCrawledAt() != null) {
            entity.setLastCrawledAt(toLocal(patch.lastCrawledAt()));
        }
        if (patch.nextCrawlAt() != null) {
            entity.setNextCrawlAt(toLocal(patch.nextCrawlAt()));
        }
        if (patch.wikidataQid() != null) {
            entity.setWikidataQid(patch.wikidataQid());
        }
        if (patch.publishedAt() != null) {
            entity.setPublishedAt(toLocal(patch.publishedAt()));
        }
        if (patch.errorMessage() != null) {
            entity.setErrorMessage(truncate(patch.errorMessage()));
        }
        entity.setUpdatedAt(LocalDateTime.now(ZoneOffset.UTC));

        return toModel(businessRepository.save(entity));
    }

    @Override
    @Transactional
    public Long createFingerprint(Long businessId, FingerprintAnalysis analysis) {
        FingerprintEntity entity = FingerprintEntity.builder()
                .businessId(businessId)
                .visibilityScore(analysis.visibilityScore())
                .mentionRate(analysis.mentionRate())
                .sentimentScore(analysis.sentimentScore())
                .accuracyScore(analysis.avgConfidence())
                .avgRankPosition(analysis.avgRankPosition())
                .llmResultsJson(writeJson(analysis.results()))
                .leaderboardJson(writeJson(analysis.competitiveLeaderboard()))
                .createdAt(toLocal(analysis.generatedAt()))
                .build();
        Long id = fingerprintRepository.save(entity).getId();
        log.debug("Stored fingerprint {} for business {}", id, businessId);
        return id;
    }

    @Override
    @Transactional
    public Long createCrawlJob(Long businessId, String jobType) {
        CrawlJobEntity job = CrawlJobEntity.builder()
                .businessId(businessId)
                .jobType(jobType)
                .status(JOB_RUNNING)
                .startedAt(LocalDateTime.now(ZoneOffset.UTC))
                .build();
        return crawlJobRepository.save(job).getId();
    }

    @Override
    @Transactional
    public void updateCrawlJob(Long jobId, String status, String errorMessage) {
        CrawlJobEntity job = crawlJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Crawl job not found: " + jobId));
        job.setStatus(status);
        job.setErrorMessage(truncate(errorMessage));
        if (!JOB_RUNNING.equals(status)) {
            job.setCompletedAt(LocalDateTime.now(ZoneOffset.UTC));
        }
        crawlJobRepository.save(job);
    }

    private Business toModel(BusinessEntity entity) {
        return Business.builder()
                .id(entity.getId())
                .name(entity.getName())
                .url(entity.getUrl())
                .category(entity.getCategory())
                .location(new Location(entity.getCity(), entity.getState(), entity.getCountry()))
                .plan(entity.getPlan())
                .automationEnabled(entity.isAutomationEnabled())
                .status(entity.getStatus())
                .crawlData(readCrawlData(entity.getCrawlDataJson()))
                .lastCrawledAt(toInstant(entity.getLastCrawledAt()))
                .nextCrawlAt(toInstant(entity.getNextCrawlAt()))
                .wikidataQid(entity.getWikidataQid())
                .publishedAt(toInstant(entity.getPublishedAt()))
                .build();
    }

    private CrawlData readCrawlData(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, CrawlData.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored crawl data is unreadable, ignoring it: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() > 1000 ? value.substring(0, 1000) : value;
    }

    private static LocalDateTime toLocal(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(LocalDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant(ZoneOffset.UTC);
    }
}
