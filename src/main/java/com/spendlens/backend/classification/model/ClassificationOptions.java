package com.spendlens.backend.classification.model;

import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.exceptions.InvalidInputException;

/**
 * Per-call routing options.
 *
 * @param enableLlmFallback      allow a single-item inference call when rule and statistical stages are not confident
 * @param lowConfidenceThreshold minimum confidence for an accepted rule/statistical result
 * @param useLlmOnly             skip the rule and statistical stages
 */
public record ClassificationOptions(boolean enableLlmFallback, double lowConfidenceThreshold, boolean useLlmOnly) {

    public ClassificationOptions {
        if (lowConfidenceThreshold < 0.0 || lowConfidenceThreshold > 1.0) {
            throw new InvalidInputException("lowConfidenceThreshold must be between 0.0 and 1.0");
        }
    }

    public static ClassificationOptions from(ClassificationProperties properties) {
        return new ClassificationOptions(properties.isEnableLlmFallback(), properties.getLowConfidenceThreshold(), false);
    }

    public ClassificationOptions withLlmFallback(boolean enabled) {
        return new ClassificationOptions(enabled, lowConfidenceThreshold, useLlmOnly);
    }
}
