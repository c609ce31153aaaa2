package com.procurement.stats;

import com.procurement.contract.AcceptedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Two-pass mean / standard deviation over accepted spend amounts, in decimal
 * arithmetic so repeated runs give identical thresholds.
 */
public class StatisticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

    static final MathContext PRECISION = MathContext.DECIMAL64;

    private final DeviationMode mode;

    public StatisticsAggregator(DeviationMode mode) {
        this.mode = mode;
    }

    public SpendStatistics aggregate(List<AcceptedTransaction> accepted) {
        long count = accepted.size();
        long divisor = mode == DeviationMode.SAMPLE ? count - 1 : count;
        if (count == 0 || divisor <= 0) {
            log.info("Spend statistics undefined: accepted_rows={}, mode={}", count, mode);
            return SpendStatistics.undefined(count, mode);
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (AcceptedTransaction row : accepted) {
            sum = sum.add(row.transaction().spendAmount());
        }
        BigDecimal mean = sum.divide(BigDecimal.valueOf(count), PRECISION);

        BigDecimal squaredDeviations = BigDecimal.ZERO;
        for (AcceptedTransaction row : accepted) {
            BigDecimal deviation = row.transaction().spendAmount().subtract(mean);
            squaredDeviations = squaredDeviations.add(deviation.multiply(deviation));
        }
        BigDecimal variance = squaredDeviations.divide(BigDecimal.valueOf(divisor), PRECISION);
        BigDecimal standardDeviation = variance.sqrt(PRECISION);

        log.info("Spend statistics: accepted_rows={}, mean={}, stddev={}, mode={}",
            count, mean.toPlainString(), standardDeviation.toPlainString(), mode);
        return new SpendStatistics(count, mean, standardDeviation, mode);
    }
}
