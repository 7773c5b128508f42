package com.spendlens.backend.classification.stages;

import com.spendlens.backend.classification.model.CategorizationMethod;

/**
 * Category chosen by one stage of the decision engine.
 */
public record StageDecision(
        String category,
        String subcategory,
        String merchantName,
        CategorizationMethod method,
        double confidence,
        String reason
) {
}
