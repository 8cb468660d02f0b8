package dev.visibility.entity;

import dev.visibility.model.BusinessStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Tracked business. Crawl data is kept as a JSON document.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "businesses", indexes = {
        @Index(name = "idx_next_crawl_at", columnList = "nextCrawlAt"),
        @Index(name = "idx_automation_enabled", columnList = "automationEnabled")
})
public class BusinessEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 2048)
    private String url;

    private String category;

    private String city;

    private String state;

    private String country;

    @Column(nullable = false)
    private String plan;

    @Column(nullable = false)
    private boolean automationEnabled;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BusinessStatus status;

    @Column(columnDefinition = "TEXT")
    private String crawlDataJson;

    private LocalDateTime lastCrawledAt;

    private LocalDateTime nextCrawlAt;

    private String wikidataQid;

    private LocalDateTime publishedAt;

    @Column(length = 1000)
    private String errorMessage;

    private LocalDateTime updatedAt;
}
