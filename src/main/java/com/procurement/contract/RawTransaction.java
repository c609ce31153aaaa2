package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One staging row as exported by the source ERP. Every field may be absent;
 * validation is the quality gate's job, never the loader's.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RawTransaction(
    @JsonProperty("purchase_id") String purchaseId,
    @JsonProperty("vendor_name") String vendorName,
    @JsonProperty("category") String category,
    @JsonProperty("sub_category") String subCategory,
    @JsonProperty("spend_amount") BigDecimal spendAmount,
    @JsonProperty("purchase_date") LocalDate purchaseDate,
    @JsonProperty("region") String region,
    @JsonProperty("payment_terms") String paymentTerms,
    @JsonProperty("delivery_time_days") Integer deliveryTimeDays,
    @JsonProperty("quality_score") Integer qualityScore,
    @JsonProperty("vendor_score") Integer vendorScore
) {}
