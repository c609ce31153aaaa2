package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Analysis-ready spend fact, one per accepted transaction.
 *
 * {@code cleanVendorName} is null when the vendor lookup missed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FactRecord(
    @JsonProperty("purchase_id") String purchaseId,
    @JsonProperty("clean_vendor_name") String cleanVendorName,
    @JsonProperty("category") String category,
    @JsonProperty("sub_category") String subCategory,
    @JsonProperty("spend_amount") BigDecimal spendAmount,
    @JsonProperty("purchase_date") LocalDate purchaseDate,
    @JsonProperty("purchase_month") String purchaseMonth,
    @JsonProperty("region") String region,
    @JsonProperty("payment_terms") String paymentTerms,
    @JsonProperty("delivery_time_days") Integer deliveryTimeDays,
    @JsonProperty("quality_score") Integer qualityScore,
    @JsonProperty("vendor_score") Integer vendorScore,
    @JsonProperty("contract_status") ContractStatus contractStatus,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("outlier_flag") boolean outlierFlag,
    @JsonProperty("load_timestamp") Instant loadTimestamp
) {
}
