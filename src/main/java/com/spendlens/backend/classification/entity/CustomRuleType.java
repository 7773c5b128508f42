package com.spendlens.backend.classification.entity;

/**
 * How a custom category rule tests a transaction.
 */
public enum CustomRuleType {
    /** Description contains the value. */
    KEYWORD,
    /** Resolved merchant name contains the value. */
    MERCHANT,
    /** Absolute amount within [minAmount, maxAmount]. */
    AMOUNT_RANGE,
    /** Absolute amount above minAmount. */
    AMOUNT_ABOVE,
    /** Absolute amount below maxAmount. */
    AMOUNT_BELOW,
    /** Regular expression found in the description, case-insensitive. */
    REGEX,
    /** Transaction date falls on the named day, e.g. SATURDAY. */
    DAY_OF_WEEK,
    /** Engine category contains the value. */
    ORIGINAL_CATEGORY
}
