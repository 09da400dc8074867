package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.listingwatch.tracker.domain.model.enums.IngestStatus;

import java.util.List;

/**
 * Response for batch ingestion; {@code results} is in request order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchIngestionResponse {

    private int total;
    private int accepted;
    private int unchanged;
    private int rejected;
    private List<IngestResult> results;

    public static BatchIngestionResponse of(List<IngestResult> results) {
        return BatchIngestionResponse.builder()
                .total(results.size())
                .accepted(count(results, IngestStatus.ACCEPTED))
                .unchanged(count(results, IngestStatus.UNCHANGED))
                .rejected(count(results, IngestStatus.REJECTED))
                .results(results)
                .build();
    }

    private static int count(List<IngestResult> results, IngestStatus status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }
}
