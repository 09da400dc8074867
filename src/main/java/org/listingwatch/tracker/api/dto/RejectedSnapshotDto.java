package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.domain.model.RejectedSnapshot;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RejectedSnapshotDto {

    private UUID id;
    private String source;
    private String listingId;
    private Map<String, Object> rawPayload;
    private String rejectionReason;
    private String failureStage;
    private String errorDetails;
    private String correlationId;
    private OffsetDateTime receivedAt;
    private boolean resolved;
    private OffsetDateTime resolvedAt;

    public static RejectedSnapshotDto from(RejectedSnapshot rejected) {
        return RejectedSnapshotDto.builder()
                .id(rejected.getId())
                .source(rejected.getSource())
                .listingId(rejected.getListingId())
                .rawPayload(rejected.getRawPayload())
                .rejectionReason(rejected.getRejectionReason().name())
                .failureStage(rejected.getFailureStage().name())
                .errorDetails(rejected.getErrorDetails())
                .correlationId(rejected.getCorrelationId())
                .receivedAt(rejected.getReceivedAt())
                .resolved(rejected.isResolved())
                .resolvedAt(rejected.getResolvedAt())
                .build();
    }
}
