package com.procurement.store;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.FactRecord;
import com.procurement.contract.PipelineRunSummary;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.RejectedTransaction;
import com.procurement.contract.VendorNormalizationEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class InMemoryProcurementStore implements ProcurementStore {

    private final AtomicReference<List<RawTransaction>> raw = new AtomicReference<>(List.of());
    private final AtomicReference<DerivedTables> derived = new AtomicReference<>(DerivedTables.empty());
    private final CopyOnWriteArrayList<PipelineRunSummary> runLog = new CopyOnWriteArrayList<>();

    @Override
    public List<RawTransaction> readAllRaw() {
        return raw.get();
    }

    @Override
    public void replaceAllRaw(List<RawTransaction> rows) {
        raw.set(copyOf(rows));
    }

    @Override
    public List<VendorNormalizationEntry> readNormalizationMap() {
        return derived.get().normalizationMap();
    }

    @Override
    public void upsertNormalization(VendorNormalizationEntry entry) {
        derived.updateAndGet(current -> {
            Map<String, VendorNormalizationEntry> byRawName = new LinkedHashMap<>();
            for (VendorNormalizationEntry existing : current.normalizationMap()) {
                byRawName.put(existing.rawVendorName(), existing);
            }
            byRawName.put(entry.rawVendorName(), entry);
            return new DerivedTables(new ArrayList<>(byRawName.values()),
                current.accepted(), current.rejected(), current.facts());
        });
    }

    @Override
    public List<AcceptedTransaction> readAccepted() {
        return derived.get().accepted();
    }

    @Override
    public List<RejectedTransaction> readRejected() {
        return derived.get().rejected();
    }

    @Override
    public List<FactRecord> readFacts() {
        return derived.get().facts();
    }

    @Override
    public void commitDerived(DerivedTables tables) {
        derived.set(tables);
    }

    @Override
    public void appendRunSummary(PipelineRunSummary summary) {
        runLog.add(summary);
    }

    @Override
    public List<PipelineRunSummary> readRunSummaries() {
        return List.copyOf(runLog);
    }

    // Raw rows may carry null fields but never null elements.
    private static List<RawTransaction> copyOf(List<RawTransaction> rows) {
        List<RawTransaction> copy = new ArrayList<>(rows.size());
        for (RawTransaction row : rows) {
            if (row == null) {
                throw new IllegalArgumentException("raw rows must not contain null entries");
            }
            copy.add(row);
        }
        return List.copyOf(copy);
    }
}
