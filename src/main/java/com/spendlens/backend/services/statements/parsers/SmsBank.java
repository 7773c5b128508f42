package com.spendlens.backend.services.statements.parsers;

import java.util.Locale;

public enum SmsBank {
    HDFC,
    SBI,
    GENERIC;

    /**
     * Unknown or blank names map to {@link #GENERIC}, which triggers sender detection.
     */
    public static SmsBank from(String name) {
        if (name == null || name.isBlank()) return GENERIC;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }
}
