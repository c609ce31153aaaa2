package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * A staging row that passed every quality rule. Carries the source row unchanged.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AcceptedTransaction(
    @JsonProperty("transaction") RawTransaction transaction,
    @JsonProperty("quality_flag") String qualityFlag,
    @JsonProperty("load_timestamp") Instant loadTimestamp
) {

    public static final String VALID = "VALID";

    public static AcceptedTransaction valid(RawTransaction transaction, Instant loadTimestamp) {
        return new AcceptedTransaction(transaction, VALID, loadTimestamp);
    }
}
