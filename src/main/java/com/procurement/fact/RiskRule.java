package com.procurement.fact;

import com.procurement.contract.RawTransaction;
import com.procurement.contract.RiskLevel;

/**
 * A single risk classification rule. Rules are evaluated in order and the
 * first match decides the level, so overlapping rules are resolved by position.
 */
public interface RiskRule {

    /** Unique rule identifier, e.g. "high-risk-scores". */
    String ruleId();

    /** Level assigned when this rule matches. */
    RiskLevel level();

    /**
     * Whether the rule applies. Absent scores never satisfy a comparison.
     */
    boolean matches(RawTransaction transaction);
}
