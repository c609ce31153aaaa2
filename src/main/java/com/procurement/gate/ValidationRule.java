package com.procurement.gate;

import com.procurement.contract.RawTransaction;

/**
 * One clause of the acceptance predicate. Rules are pure functions of a single
 * staging row; a row is accepted only when every rule passes.
 */
public interface ValidationRule {

    /** Stable identifier recorded on rejected rows, e.g. "SPEND_AMOUNT_POSITIVE". */
    String ruleId();

    boolean passes(RawTransaction row);
}
