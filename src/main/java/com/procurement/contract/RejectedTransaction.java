package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * A staging row that failed at least one quality rule.
 *
 * {@code failedRules} lists every failing rule id in evaluation order, so an
 * operator can diagnose the row even when the reason is the generic one.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RejectedTransaction(
    @JsonProperty("purchase_id") String purchaseId,
    @JsonProperty("transaction") RawTransaction transaction,
    @JsonProperty("reject_reason") String rejectReason,
    @JsonProperty("failed_rules") List<String> failedRules,
    @JsonProperty("reject_time") Instant rejectTime
) {

    public RejectedTransaction {
        failedRules = List.copyOf(failedRules);
    }
}
