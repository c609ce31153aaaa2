package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Audit log row for one pipeline execution. Append-only.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PipelineRunSummary(
    @JsonProperty("run_id") String runId,
    @JsonProperty("action_type") String actionType,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("raw_row_count") long rawRowCount,
    @JsonProperty("accepted_row_count") long acceptedRowCount,
    @JsonProperty("rejected_row_count") long rejectedRowCount,
    @JsonProperty("fact_row_count") long factRowCount,
    @JsonProperty("unresolved_vendor_count") long unresolvedVendorCount,
    @JsonProperty("outlier_count") long outlierCount,
    @JsonProperty("description") String description,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static final String PIPELINE_RUN = "PIPELINE_RUN";
}
