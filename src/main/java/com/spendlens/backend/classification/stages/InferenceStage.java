package com.spendlens.backend.classification.stages;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.services.chunking.ChunkedInferenceOrchestrator;
import com.spendlens.backend.services.chunking.InferredClassification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Last-resort single-item inference call. Skipped when fallback is off or no provider is
 * configured, so no network call happens in those cases.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InferenceStage implements ClassificationStage {

    private final ChunkedInferenceOrchestrator orchestrator;
    private final ClassificationProperties properties;

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public Optional<StageDecision> evaluate(StageContext context) {
        if (!context.getOptions().enableLlmFallback()) return Optional.empty();
        String description = context.getTransaction().description();
        if (description == null || description.isBlank()) return Optional.empty();
        if (!orchestrator.isAvailable()) return Optional.empty();

        Optional<InferredClassification> inferred;
        try {
            inferred = orchestrator.classifySingle(context.getTransaction());
        } catch (RuntimeException e) {
            log.warn("[Classify] Inference fallback failed for '{}': {}", context.getTransaction().id(), e.getMessage());
            return Optional.empty();
        }

        return inferred.map(c -> toDecision(c, context.merchantHint()));
    }

    /**
     * A provider answer without a category is recorded as Uncategorized with zero confidence; an
     * answer without a confidence gets the configured assumed confidence.
     */
    public StageDecision toDecision(InferredClassification inferred, String merchantHint) {
        String merchant = inferred.merchantName() != null ? inferred.merchantName() : merchantHint;
        if (inferred.category() == null) {
            return new StageDecision(Taxonomy.UNCATEGORIZED, null, merchant, CategorizationMethod.LLM, 0.0,
                    "Inference returned no usable category");
        }
        double confidence = inferred.confidence() != null ? inferred.confidence() : properties.getLlmAssumedConfidence();
        return new StageDecision(inferred.category(), inferred.subcategory(), merchant, CategorizationMethod.LLM,
                confidence, inferred.confidence() != null ? "Inference" : "Inference (assumed confidence)");
    }
}
