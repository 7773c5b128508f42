package com.spendlens.backend.classification.registry;

import java.time.LocalDateTime;

import com.spendlens.backend.classification.entity.MerchantRuleEntry;
import com.spendlens.backend.classification.entity.RuleSource;

/**
 * Immutable view of a {@link MerchantRuleEntry}, safe to share between request threads.
 */
public record RegistryRule(
        String pattern,
        String category,
        String subcategory,
        String merchantName,
        double confidence,
        RuleSource source,
        LocalDateTime lastUpdated
) {
    public static RegistryRule of(MerchantRuleEntry entry) {
        return new RegistryRule(
                entry.getPattern(),
                entry.getCategory(),
                entry.getSubcategory(),
                entry.getMerchantName(),
                entry.getConfidence(),
                entry.getSource(),
                entry.getLastUpdated()
        );
    }

    public boolean isLearned() {
        return source == RuleSource.LEARNED;
    }
}
