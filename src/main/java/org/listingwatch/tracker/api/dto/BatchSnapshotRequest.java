package org.listingwatch.tracker.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSnapshotRequest {

    @NotEmpty(message = "snapshots list must not be empty")
    @Size(max = 500, message = "batch may contain at most 500 snapshots")
    @Valid
    private List<SnapshotIngestionRequest> snapshots;
}
