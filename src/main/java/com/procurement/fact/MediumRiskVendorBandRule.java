package com.procurement.fact;

import com.procurement.contract.RawTransaction;
import com.procurement.contract.RiskLevel;

/**
 * MEDIUM when the vendor score lies in an inclusive band.
 */
public class MediumRiskVendorBandRule implements RiskRule {

    private final int minInclusive;
    private final int maxInclusive;

    public MediumRiskVendorBandRule(int minInclusive, int maxInclusive) {
        this.minInclusive = minInclusive;
        this.maxInclusive = maxInclusive;
    }

    @Override
    public String ruleId() {
        return "medium-risk-vendor-band";
    }

    @Override
    public RiskLevel level() {
        return RiskLevel.MEDIUM;
    }

    @Override
    public boolean matches(RawTransaction transaction) {
        Integer vendorScore = transaction.vendorScore();
        return vendorScore != null && vendorScore >= minInclusive && vendorScore <= maxInclusive;
    }
}
