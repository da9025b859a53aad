package com.compara.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

/**
 * JPA entity for usage_records table.
 * One immutable row per completed comparison.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "usage_records", indexes = {
        @Index(name = "idx_usage_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_usage_ip_created", columnList = "ip_address, created_at")
})
public class UsageRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "browser_fingerprint", length = 64)
    private String browserFingerprint;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "models_used", nullable = false, columnDefinition = "jsonb")
    private List<String> modelsUsed;

    @Column(name = "input_length", nullable = false)
    private Integer inputLength;

    @Column(name = "models_requested", nullable = false)
    private Integer modelsRequested;

    @Column(name = "models_successful", nullable = false)
    private Integer modelsSuccessful;

    @Column(name = "models_failed", nullable = false)
    private Integer modelsFailed;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    // Tokens
    @Column(name = "input_tokens")
    private Long inputTokens;

    @Column(name = "output_tokens")
    private Long outputTokens;

    @Column(name = "total_tokens")
    private Long totalTokens;

    @Column(name = "effective_tokens")
    private Long effectiveTokens;

    @Column(name = "credits_used")
    private Long creditsUsed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
