package com.procurement.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VendorOverrideRequest(
    @JsonProperty("raw_vendor_name") String rawVendorName,
    @JsonProperty("clean_vendor_name") String cleanVendorName
) {}
