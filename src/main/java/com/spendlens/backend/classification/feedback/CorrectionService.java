package com.spendlens.backend.classification.feedback;

import java.util.List;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.entity.CategoryCorrection;
import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.registry.MerchantRuleRegistry;
import com.spendlens.backend.classification.registry.RegistryRule;
import com.spendlens.backend.classification.rules.DescriptionNormalizer;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.exceptions.InvalidInputException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records user corrections and turns them into learned registry rules.
 *
 * The rule key is the merchant name when the description contains it, otherwise the whole
 * normalized description. Learned rules get a confidence at least as high as the review
 * threshold, so the next transaction with the same key is decided at the rule stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorrectionService {

    private final CorrectionStore correctionStore;
    private final MerchantRuleRegistry registry;
    private final ClassificationProperties properties;

    public CategoryCorrection recordCorrection(CorrectionCommand command) {
        if (command == null) throw new InvalidInputException("correction is required");
        if (command.newCategory() == null || command.newCategory().isBlank()) {
            throw new InvalidInputException("newCategory is required");
        }

        String key = patternKey(command.description(), command.merchantName());
        if (key.isEmpty()) {
            throw new InvalidInputException("description or merchantName must contain letters or digits");
        }

        String category = Taxonomy.canonicalCategory(command.newCategory()).orElse(command.newCategory().trim());
        String subcategory = blankToNull(command.newSubcategory());
        if (subcategory != null) {
            subcategory = Taxonomy.canonicalSubcategory(category, subcategory).orElse(subcategory);
        }

        correctionStore.latest(key)
                .filter(previous -> !previous.getNewCategory().equals(category))
                .ifPresent(previous -> log.info("[Feedback] Correction for key='{}' overrides earlier category {}",
                        key, previous.getNewCategory()));

        CategoryCorrection saved = correctionStore.append(CategoryCorrection.builder()
                .transactionId(blankToNull(command.transactionId()))
                .description(truncate(command.description(), 500))
                .merchantName(blankToNull(command.merchantName()))
                .patternKey(key)
                .oldCategory(blankToNull(command.oldCategory()))
                .newCategory(category)
                .newSubcategory(subcategory)
                .build());

        log.info("[Feedback] Correction recorded key='{}' {} -> {}", key, command.oldCategory(), category);
        return saved;
    }

    public RegistryRule applyToRegistry(CategoryCorrection correction) {
        return registry.upsertLearned(
                correction.getPatternKey(),
                correction.getNewCategory(),
                correction.getNewSubcategory(),
                correction.getMerchantName(),
                properties.effectiveLearnedRuleConfidence());
    }

    public CorrectionOutcome submit(CorrectionCommand command) {
        CategoryCorrection correction = recordCorrection(command);
        RegistryRule rule = applyToRegistry(correction);

        ClassificationResult result = ClassificationResult.builder()
                .transactionId(correction.getTransactionId())
                .category(correction.getNewCategory())
                .subcategory(correction.getNewSubcategory())
                .merchantName(correction.getMerchantName())
                .method(CategorizationMethod.MANUAL)
                .confidence(1.0)
                .needsReview(false)
                .reason("Manual correction")
                .build();
        return new CorrectionOutcome(correction, rule, result);
    }

    /**
     * Corrections for the key that {@code description}/{@code merchantName} map to, newest first.
     */
    public List<CategoryCorrection> history(String description, String merchantName) {
        String key = patternKey(description, merchantName);
        if (key.isEmpty()) return List.of();
        return correctionStore.history(key);
    }

    static String patternKey(String description, String merchantName) {
        String desc = DescriptionNormalizer.looseNormalize(description);
        String merchant = DescriptionNormalizer.looseNormalize(merchantName);
        if (!merchant.isEmpty() && (desc.isEmpty() || DescriptionNormalizer.containsTokens(desc, merchant))) {
            return merchant;
        }
        return desc;
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }

    private static String truncate(String value, int max) {
        if (value == null) return null;
        return value.length() <= max ? value : value.substring(0, max);
    }
}
