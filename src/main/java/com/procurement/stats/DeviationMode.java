package com.procurement.stats;

/**
 * Divisor used for the spend standard deviation: {@code n} for POPULATION,
 * {@code n - 1} for SAMPLE (the warehouse {@code STDEV} behavior).
 */
public enum DeviationMode {
    POPULATION,
    SAMPLE
}
