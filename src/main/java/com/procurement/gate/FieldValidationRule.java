package com.procurement.gate;

import com.procurement.contract.RawTransaction;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Predicate;

/**
 * Field-level validation rule backed by a predicate.
 *
 * Optional score fields pass when absent; only a present value outside its
 * range fails.
 */
public class FieldValidationRule implements ValidationRule {

    private final String ruleId;
    private final Predicate<RawTransaction> predicate;

    public FieldValidationRule(String ruleId, Predicate<RawTransaction> predicate) {
        this.ruleId = ruleId;
        this.predicate = predicate;
    }

    @Override
    public String ruleId() {
        return ruleId;
    }

    @Override
    public boolean passes(RawTransaction row) {
        return predicate.test(row);
    }

    /**
     * The six clauses of the procurement clean gate, in evaluation order.
     */
    public static List<ValidationRule> standardRules() {
        return List.of(
            new FieldValidationRule("PURCHASE_ID_PRESENT",
                row -> row.purchaseId() != null),
            new FieldValidationRule("VENDOR_NAME_PRESENT",
                row -> row.vendorName() != null),
            new FieldValidationRule("SPEND_AMOUNT_POSITIVE",
                row -> row.spendAmount() != null && row.spendAmount().compareTo(BigDecimal.ZERO) > 0),
            new FieldValidationRule("PURCHASE_DATE_PRESENT",
                row -> row.purchaseDate() != null),
            new FieldValidationRule("QUALITY_SCORE_IN_RANGE",
                row -> absentOrBetween(row.qualityScore(), 1, 10)),
            new FieldValidationRule("VENDOR_SCORE_IN_RANGE",
                row -> absentOrBetween(row.vendorScore(), 1, 100))
        );
    }

    static boolean absentOrBetween(Integer value, int min, int max) {
        return value == null || (value >= min && value <= max);
    }
}
