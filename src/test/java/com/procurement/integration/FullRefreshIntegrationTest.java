package com.procurement.integration;

import com.procurement.contract.ContractStatus;
import com.procurement.contract.FactRecord;
import com.procurement.contract.PipelineRunSummary;
import com.procurement.contract.RejectedTransaction;
import com.procurement.contract.RiskLevel;
import com.procurement.contract.RunStatus;
import com.procurement.contract.VendorNormalizationEntry;
import com.procurement.normalize.VendorOverrideService;
import com.procurement.pipeline.ProcurementPipelineService;
import com.procurement.store.DerivedTables;
import com.procurement.store.ProcurementStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.procurement.RawTransactionFixtures.scored;
import static com.procurement.RawTransactionFixtures.valid;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end full refresh through the Spring context:
 *
 * staging load -> normalization + gate -> statistics -> facts -> audit,
 * then a curated vendor override and a second run.
 */
@SpringBootTest
class FullRefreshIntegrationTest {

    @Autowired ProcurementStore store;
    @Autowired ProcurementPipelineService pipeline;
    @Autowired VendorOverrideService overrides;

    @BeforeEach
    void clearCuratedVendors() {
        // the store bean is shared with other tests in the same context
        store.commitDerived(DerivedTables.empty());
    }

    @Test
    @DisplayName("Full refresh: gate, classify, flag outliers and audit")
    void fullRefresh_buildsClassifiedFacts() {
        store.replaceAllRaw(List.of(
            scored("PO-1", "Acme Pvt. Ltd.", "100", 9, 40),
            scored("PO-2", "acme pvt ltd", "100", 8, 60),
            scored("PO-3", "Globex Inc", "100", 9, 90),
            scored("PO-4", "Globex Inc", "100", 8, 80),
            scored("PO-5", "Initech", "10000", 6, 80),
            valid("PO-6", "Initech", "0"),
            scored("PO-7", "Initech", "100", 12, 80)));
        int auditedBefore = store.readRunSummaries().size();

        PipelineRunSummary summary = pipeline.run();

        assertEquals(RunStatus.SUCCEEDED, summary.status());
        assertEquals(7, summary.rawRowCount());
        assertEquals(5, summary.factRowCount());
        assertEquals(2, summary.rejectedRowCount());
        assertEquals(0, summary.outlierCount(), "10000 sits exactly on mean + 2 stddev");
        assertEquals(auditedBefore + 1, store.readRunSummaries().size());

        Map<String, FactRecord> facts = store.readFacts().stream()
            .collect(Collectors.toMap(FactRecord::purchaseId, Function.identity()));
        assertEquals(RiskLevel.HIGH, facts.get("PO-1").riskLevel());
        assertEquals(RiskLevel.MEDIUM, facts.get("PO-2").riskLevel());
        assertEquals(RiskLevel.LOW, facts.get("PO-3").riskLevel());
        assertEquals(ContractStatus.CONTRACT, facts.get("PO-4").contractStatus());
        assertEquals(ContractStatus.NON_CONTRACT, facts.get("PO-5").contractStatus());
        assertFalse(facts.get("PO-5").outlierFlag());
        assertEquals("ACME", facts.get("PO-1").cleanVendorName());
        assertEquals("ACME", facts.get("PO-2").cleanVendorName());
        assertEquals("GLOBEX", facts.get("PO-3").cleanVendorName());
        assertEquals("2024-03", facts.get("PO-1").purchaseMonth());

        List<RejectedTransaction> rejects = store.readRejected();
        assertEquals(List.of("PO-6", "PO-7"), rejects.stream().map(RejectedTransaction::purchaseId).toList());
        rejects.forEach(r -> assertEquals("FAILED DATA QUALITY RULES", r.rejectReason()));
    }

    @Test
    @DisplayName("Manual vendor override persists across full refreshes")
    void manualOverride_survivesRerun() {
        store.replaceAllRaw(List.of(
            valid("PO-10", "Umbrella Corp Ltd", "50"),
            valid("PO-11", "Hooli", "70")));
        pipeline.run();

        overrides.override("Umbrella Corp Ltd", "UMBRELLA CORPORATION");
        pipeline.run();
        pipeline.run();

        Map<String, VendorNormalizationEntry> map = store.readNormalizationMap().stream()
            .collect(Collectors.toMap(VendorNormalizationEntry::rawVendorName, Function.identity()));
        assertEquals(2, map.size());
        assertTrue(map.get("Umbrella Corp Ltd").manualOverride());
        assertEquals("HOOLI", map.get("Hooli").cleanVendorName());

        FactRecord fact = store.readFacts().stream()
            .filter(f -> "PO-10".equals(f.purchaseId()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("missing fact PO-10"));
        assertEquals("UMBRELLA CORPORATION", fact.cleanVendorName());
    }
}
