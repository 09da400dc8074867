package org.listingwatch.tracker.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One scraped listing payload as submitted by a scraper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotIngestionRequest {

    @NotBlank(message = "source is required")
    private String source;

    // falls back to the payload's scrapedAt, then to the receive time
    private OffsetDateTime observedAt;

    @NotNull(message = "payload is required")
    private JsonNode payload;
}
