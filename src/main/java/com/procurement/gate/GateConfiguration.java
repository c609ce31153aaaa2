package com.procurement.gate;

import com.procurement.config.ProcurementProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GateConfiguration {

    @Bean
    public QualityGate qualityGate(ProcurementProperties properties) {
        return new QualityGate(
            FieldValidationRule.standardRules(),
            properties.getGate().getRejectReason(),
            properties.getGate().isDetailedRejectReasons());
    }
}
