package com.spendlens.backend.classification.model;

import java.math.BigDecimal;

public record SplitItem(
        String name,
        BigDecimal amount,
        String category,
        String subcategory,
        CategorizationMethod method,
        double confidence,
        boolean needsReview
) {
}
