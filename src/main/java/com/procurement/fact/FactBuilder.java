package com.procurement.fact;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.FactRecord;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.VendorNormalizationEntry;
import com.procurement.stats.SpendStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fact Builder: enriches each accepted transaction into one spend fact.
 *
 * Per fact:
 * - clean vendor via left-outer lookup on the raw vendor name (null on miss)
 * - purchase month as yyyy-MM
 * - contract status, ordered risk level and outlier flag
 *
 * Deterministic given the same inputs apart from the load timestamp.
 */
public class FactBuilder {

    private static final Logger log = LoggerFactory.getLogger(FactBuilder.class);

    static final DateTimeFormatter PURCHASE_MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private final ContractClassifier contractClassifier;
    private final RiskClassifier riskClassifier;
    private final BigDecimal outlierDeviations;

    public FactBuilder(ContractClassifier contractClassifier,
                       RiskClassifier riskClassifier,
                       BigDecimal outlierDeviations) {
        this.contractClassifier = contractClassifier;
        this.riskClassifier = riskClassifier;
        this.outlierDeviations = outlierDeviations;
    }

    public FactBuildResult build(List<AcceptedTransaction> accepted,
                                 List<VendorNormalizationEntry> normalizationMap,
                                 SpendStatistics statistics,
                                 Instant loadTimestamp) {
        Map<String, String> cleanNames = new HashMap<>();
        for (VendorNormalizationEntry entry : normalizationMap) {
            cleanNames.put(entry.rawVendorName(), entry.cleanVendorName());
        }
        OutlierDetector outliers = new OutlierDetector(statistics, outlierDeviations);

        List<FactRecord> facts = new ArrayList<>(accepted.size());
        long unresolved = 0;
        long outlierCount = 0;
        for (AcceptedTransaction row : accepted) {
            RawTransaction tx = row.transaction();
            String cleanVendor = cleanNames.get(tx.vendorName());
            if (cleanVendor == null) {
                unresolved++;
                log.warn("No normalization entry for vendor '{}' (purchase_id={})",
                    tx.vendorName(), tx.purchaseId());
            }
            boolean outlier = outliers.isOutlier(tx.spendAmount());
            if (outlier) {
                outlierCount++;
            }

            facts.add(new FactRecord(
                tx.purchaseId(),
                cleanVendor,
                tx.category(),
                tx.subCategory(),
                tx.spendAmount(),
                tx.purchaseDate(),
                tx.purchaseDate().format(PURCHASE_MONTH),
                tx.region(),
                tx.paymentTerms(),
                tx.deliveryTimeDays(),
                tx.qualityScore(),
                tx.vendorScore(),
                contractClassifier.classify(tx),
                riskClassifier.classify(tx),
                outlier,
                loadTimestamp
            ));
        }

        log.info("Built {} facts: unresolved_vendors={}, outliers={}, outlier_threshold={}",
            facts.size(), unresolved, outlierCount,
            outliers.threshold().map(BigDecimal::toPlainString).orElse("undefined"));
        return new FactBuildResult(facts, unresolved, outlierCount);
    }
}
