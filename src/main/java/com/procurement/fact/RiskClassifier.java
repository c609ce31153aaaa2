package com.procurement.fact;

import com.procurement.contract.RawTransaction;
import com.procurement.contract.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered risk classification; first matching rule wins, LOW otherwise.
 */
public class RiskClassifier {

    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);

    private final List<RiskRule> rules;

    public RiskClassifier(List<RiskRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public RiskLevel classify(RawTransaction transaction) {
        for (RiskRule rule : rules) {
            if (rule.matches(transaction)) {
                log.debug("purchase_id={} matched risk rule {} -> {}",
                    transaction.purchaseId(), rule.ruleId(), rule.level());
                return rule.level();
            }
        }
        return RiskLevel.LOW;
    }
}
