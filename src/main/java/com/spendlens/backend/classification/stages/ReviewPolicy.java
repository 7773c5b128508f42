package com.spendlens.backend.classification.stages;

import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.config.ClassificationProperties.LlmReviewPolicy;

public final class ReviewPolicy {

    private ReviewPolicy() {}

    public static boolean needsReview(double confidence, CategorizationMethod method, double threshold, LlmReviewPolicy llmPolicy) {
        if (method == CategorizationMethod.MANUAL) return false;
        if (method == CategorizationMethod.LLM && llmPolicy == LlmReviewPolicy.ALWAYS) return true;
        return confidence < threshold;
    }
}
