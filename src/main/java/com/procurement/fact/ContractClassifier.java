package com.procurement.fact;

import com.procurement.contract.ContractStatus;
import com.procurement.contract.RawTransaction;

/**
 * Contract when both scores reach their minimums. An absent score never does.
 */
public class ContractClassifier {

    private final int minVendorScore;
    private final int minQualityScore;

    public ContractClassifier(int minVendorScore, int minQualityScore) {
        this.minVendorScore = minVendorScore;
        this.minQualityScore = minQualityScore;
    }

    public ContractStatus classify(RawTransaction transaction) {
        Integer vendorScore = transaction.vendorScore();
        Integer qualityScore = transaction.qualityScore();
        boolean contracted = vendorScore != null && vendorScore >= minVendorScore
            && qualityScore != null && qualityScore >= minQualityScore;
        return contracted ? ContractStatus.CONTRACT : ContractStatus.NON_CONTRACT;
    }
}
