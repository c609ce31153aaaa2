package com.procurement.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Master-data row translating one raw vendor spelling to its canonical name.
 * Keyed by {@code rawVendorName} (case-sensitive).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VendorNormalizationEntry(
    @JsonProperty("raw_vendor_name") String rawVendorName,
    @JsonProperty("clean_vendor_name") String cleanVendorName,
    @JsonProperty("normalization_rule") String normalizationRule,
    @JsonProperty("manual_override") boolean manualOverride,
    @JsonProperty("created_at") Instant createdAt
) {}
