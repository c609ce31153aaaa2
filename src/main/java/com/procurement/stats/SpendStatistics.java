package com.procurement.stats;

import java.math.BigDecimal;

/**
 * Mean and standard deviation of accepted spend. {@code mean} and
 * {@code standardDeviation} are null when undefined for the input size.
 */
public record SpendStatistics(
    long count,
    BigDecimal mean,
    BigDecimal standardDeviation,
    DeviationMode deviationMode
) {

    public static SpendStatistics undefined(long count, DeviationMode mode) {
        return new SpendStatistics(count, null, null, mode);
    }

    public boolean isDefined() {
        return mean != null && standardDeviation != null;
    }
}
