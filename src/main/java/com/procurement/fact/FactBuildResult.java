package com.procurement.fact;

import com.procurement.contract.FactRecord;

import java.util.List;

public record FactBuildResult(
    List<FactRecord> facts,
    long unresolvedVendorCount,
    long outlierCount
) {

    public FactBuildResult {
        facts = List.copyOf(facts);
    }
}
