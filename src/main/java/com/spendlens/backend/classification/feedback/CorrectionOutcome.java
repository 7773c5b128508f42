package com.spendlens.backend.classification.feedback;

import com.spendlens.backend.classification.entity.CategoryCorrection;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.registry.RegistryRule;

/**
 * @param result the corrected classification, method {@code manual}
 */
public record CorrectionOutcome(CategoryCorrection correction, RegistryRule rule, ClassificationResult result) {
}
