package com.procurement.fact;

import com.procurement.contract.RawTransaction;
import com.procurement.contract.RiskLevel;

/**
 * HIGH when either the vendor score or the quality score falls below its floor.
 */
public class HighRiskScoreRule implements RiskRule {

    private final int vendorScoreBelow;
    private final int qualityScoreBelow;

    public HighRiskScoreRule(int vendorScoreBelow, int qualityScoreBelow) {
        this.vendorScoreBelow = vendorScoreBelow;
        this.qualityScoreBelow = qualityScoreBelow;
    }

    @Override
    public String ruleId() {
        return "high-risk-scores";
    }

    @Override
    public RiskLevel level() {
        return RiskLevel.HIGH;
    }

    @Override
    public boolean matches(RawTransaction transaction) {
        Integer vendorScore = transaction.vendorScore();
        Integer qualityScore = transaction.qualityScore();
        return (vendorScore != null && vendorScore < vendorScoreBelow)
            || (qualityScore != null && qualityScore < qualityScoreBelow);
    }
}
