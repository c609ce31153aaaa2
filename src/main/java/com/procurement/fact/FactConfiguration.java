package com.procurement.fact;

import com.procurement.config.ProcurementProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class FactConfiguration {

    /**
     * Fact builder with the warehouse classification rules. Risk rules are
     * ordered: the HIGH rule must precede the MEDIUM band.
     */
    @Bean
    public FactBuilder factBuilder(ProcurementProperties properties) {
        ProcurementProperties.Fact fact = properties.getFact();
        return new FactBuilder(
            new ContractClassifier(fact.getContractMinVendorScore(), fact.getContractMinQualityScore()),
            new RiskClassifier(List.of(
                new HighRiskScoreRule(fact.getHighRiskVendorScoreBelow(), fact.getHighRiskQualityScoreBelow()),
                new MediumRiskVendorBandRule(fact.getMediumRiskVendorScoreMin(), fact.getMediumRiskVendorScoreMax())
            )),
            fact.getOutlierDeviations());
    }
}
