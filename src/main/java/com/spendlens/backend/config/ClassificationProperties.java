package com.spendlens.backend.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Routing thresholds for the classification decision engine.
 *
 * Example:
 * spendlens.classification.low-confidence-threshold=0.70
 * spendlens.classification.llm-review-policy=ALWAYS
 */
@Data
@Component
@ConfigurationProperties(prefix = "spendlens.classification")
public class ClassificationProperties {

    /**
     * Minimum confidence for a rule or statistical result to be accepted without review.
     */
    private double lowConfidenceThreshold = 0.70;

    /**
     * Whether single-item paths may call an inference provider as last resort.
     */
    private boolean enableLlmFallback = true;

    private LlmReviewPolicy llmReviewPolicy = LlmReviewPolicy.ON_LOW_CONFIDENCE;

    /**
     * Confidence recorded when a provider returns a category without a numeric confidence.
     */
    private double llmAssumedConfidence = 0.70;

    /**
     * Confidence of registry entries learned from user corrections.
     * Never lower than the threshold, see {@link #effectiveLearnedRuleConfidence()}.
     */
    private double learnedRuleConfidence = 0.97;

    private BigDecimal largeExpenseAmount = new BigDecimal("10000");

    public double effectiveLearnedRuleConfidence() {
        return Math.min(1.0, Math.max(learnedRuleConfidence, lowConfidenceThreshold));
    }

    public enum LlmReviewPolicy {
        /** Flag LLM results only when the provider reports a confidence below threshold. */
        ON_LOW_CONFIDENCE,
        /** Every LLM-derived category goes to review. */
        ALWAYS
    }
}
