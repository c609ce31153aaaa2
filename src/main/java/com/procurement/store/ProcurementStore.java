package com.procurement.store;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.FactRecord;
import com.procurement.contract.PipelineRunSummary;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.RejectedTransaction;
import com.procurement.contract.VendorNormalizationEntry;

import java.util.List;

public interface ProcurementStore {

    List<RawTransaction> readAllRaw();

    void replaceAllRaw(List<RawTransaction> rows);

    List<VendorNormalizationEntry> readNormalizationMap();

    /** Inserts or replaces a single normalization entry keyed by raw vendor name. */
    void upsertNormalization(VendorNormalizationEntry entry);

    List<AcceptedTransaction> readAccepted();

    List<RejectedTransaction> readRejected();

    List<FactRecord> readFacts();

    /**
     * Replaces the normalization map, accepted, rejected and fact tables of
     * one run at once. Readers see either the previous run's tables or these,
     * never a mix.
     */
    void commitDerived(DerivedTables tables);

    void appendRunSummary(PipelineRunSummary summary);

    List<PipelineRunSummary> readRunSummaries();
}
