package dev.visibility.repository;

import dev.visibility.entity.CrawlJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CrawlJobRepository extends JpaRepository<CrawlJobEntity, Long> {

    List<CrawlJobEntity> findByBusinessId(Long businessId);
}
