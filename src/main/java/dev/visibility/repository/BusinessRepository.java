package dev.visibility.repository;

import dev.visibility.entity.BusinessEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for tracked businesses.
 */
@Repository
public interface BusinessRepository extends JpaRepository<BusinessEntity, Long> {

    /**
     * Businesses with automation on whose next crawl is unset or not after the cutoff.
     */
    @Query("SELECT b FROM BusinessEntity b WHERE b.automationEnabled = true "
            + "AND (b.nextCrawlAt IS NULL OR b.nextCrawlAt <= :cutoff) ORDER BY b.id")
    List<BusinessEntity> findAutomationCandidates(LocalDateTime cutoff);

    /**
     * Due candidates plus businesses never crawled or last crawled before {@code staleBefore}.
     */
    @Query("SELECT b FROM BusinessEntity b WHERE b.automationEnabled = true "
            + "AND (b.nextCrawlAt IS NULL OR b.nextCrawlAt <= :cutoff "
            + "OR b.lastCrawledAt IS NULL OR b.lastCrawledAt < :staleBefore) ORDER BY b.id")
    List<BusinessEntity> findAutomationCandidatesIncludingStale(LocalDateTime cutoff, LocalDateTime staleBefore);

    List<BusinessEntity> findByUrl(String url);
}
