package com.procurement.store;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.FactRecord;
import com.procurement.contract.RejectedTransaction;
import com.procurement.contract.VendorNormalizationEntry;

import java.util.List;

/**
 * Staged output of one pipeline run, published as a unit.
 */
public record DerivedTables(
    List<VendorNormalizationEntry> normalizationMap,
    List<AcceptedTransaction> accepted,
    List<RejectedTransaction> rejected,
    List<FactRecord> facts
) {

    public DerivedTables {
        normalizationMap = List.copyOf(normalizationMap);
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
        facts = List.copyOf(facts);
    }

    public static DerivedTables empty() {
        return new DerivedTables(List.of(), List.of(), List.of(), List.of());
    }
}
