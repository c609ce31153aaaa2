package com.procurement.gate;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.RejectedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Quality Gate: partitions staging rows into accepted and rejected.
 *
 * Each rule is evaluated independently and a row is rejected iff at least one
 * rule failed, so acceptance and rejection are exact complements and every
 * row lands in exactly one output.
 *
 * Business keys are deduplicated here: once a purchase_id has been accepted,
 * later rows carrying it fail {@link #DUPLICATE_RULE_ID}.
 */
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final String DUPLICATE_RULE_ID = "PURCHASE_ID_UNIQUE";

    private final List<ValidationRule> rules;
    private final String rejectReason;
    private final boolean detailedReasons;

    public QualityGate(List<ValidationRule> rules, String rejectReason, boolean detailedReasons) {
        this.rules = List.copyOf(rules);
        this.rejectReason = rejectReason;
        this.detailedReasons = detailedReasons;
    }

    public GateResult partition(List<RawTransaction> rawRows, Instant loadTimestamp) {
        List<AcceptedTransaction> accepted = new ArrayList<>();
        List<RejectedTransaction> rejected = new ArrayList<>();
        Set<String> acceptedIds = new HashSet<>();

        for (RawTransaction row : rawRows) {
            List<String> failed = failedRules(row);
            if (failed.isEmpty() && acceptedIds.contains(row.purchaseId())) {
                failed = List.of(DUPLICATE_RULE_ID);
            }

            if (failed.isEmpty()) {
                acceptedIds.add(row.purchaseId());
                accepted.add(AcceptedTransaction.valid(row, loadTimestamp));
            } else {
                log.debug("Rejected purchase_id={} failed_rules={}", row.purchaseId(), failed);
                rejected.add(new RejectedTransaction(
                    row.purchaseId(), row, reasonFor(failed), failed, loadTimestamp));
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("Quality gate rejected {} of {} staging rows", rejected.size(), rawRows.size());
        }
        return new GateResult(accepted, rejected);
    }

    public List<String> failedRules(RawTransaction row) {
        List<String> failed = new ArrayList<>();
        for (ValidationRule rule : rules) {
            if (!rule.passes(row)) {
                failed.add(rule.ruleId());
            }
        }
        return failed;
    }

    private String reasonFor(List<String> failed) {
        if (!detailedReasons) {
            return rejectReason;
        }
        return rejectReason + ": " + String.join(", ", failed);
    }
}
