package org.listingwatch.tracker.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.listingwatch.tracker.domain.model.enums.FailureStage;
import org.listingwatch.tracker.domain.model.enums.RejectionReason;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Dead-letter store for snapshots that could not be applied.
 */
@Entity
@Table(name = "rejected_snapshot")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RejectedSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String source;

    @Column(name = "listing_id")
    private String listingId;

    @Column(name = "raw_payload", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> rawPayload;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", nullable = false)
    private RejectionReason rejectionReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_stage", nullable = false)
    private FailureStage failureStage;

    @Column(name = "error_details", columnDefinition = "TEXT")
    private String errorDetails;

    @Column(name = "correlation_id")
    private String correlationId;

    @Column(name = "received_at", nullable = false)
    @Builder.Default
    private OffsetDateTime receivedAt = OffsetDateTime.now();

    @Column(nullable = false)
    @Builder.Default
    private boolean resolved = false;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;
}
