package com.procurement.fact;

import com.procurement.stats.SpendStatistics;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Flags spend strictly above {@code mean + deviations × stddev}. With
 * undefined statistics nothing is an outlier.
 */
public class OutlierDetector {

    private final BigDecimal threshold;

    public OutlierDetector(SpendStatistics statistics, BigDecimal deviations) {
        this.threshold = statistics.isDefined()
            ? statistics.mean().add(deviations.multiply(statistics.standardDeviation()))
            : null;
    }

    public Optional<BigDecimal> threshold() {
        return Optional.ofNullable(threshold);
    }

    public boolean isOutlier(BigDecimal spendAmount) {
        return threshold != null && spendAmount.compareTo(threshold) > 0;
    }
}
