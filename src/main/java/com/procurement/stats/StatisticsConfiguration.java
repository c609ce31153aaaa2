package com.procurement.stats;

import com.procurement.config.ProcurementProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatisticsConfiguration {

    @Bean
    public StatisticsAggregator statisticsAggregator(ProcurementProperties properties) {
        return new StatisticsAggregator(properties.getStatistics().getDeviation());
    }
}
