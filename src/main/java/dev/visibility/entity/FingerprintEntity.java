package dev.visibility.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored fingerprint run. Per-query results and the leaderboard are JSON documents.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "fingerprints", indexes = {
        @Index(name = "idx_fingerprint_business", columnList = "businessId")
})
public class FingerprintEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long businessId;

    @Column(nullable = false)
    private int visibilityScore;

    private double mentionRate;

    private double sentimentScore;

    private double accuracyScore;

    private Double avgRankPosition;

    @Column(columnDefinition = "TEXT")
    private String llmResultsJson;

    @Column(columnDefinition = "TEXT")
    private String leaderboardJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
