package com.spendlens.backend.classification.registry;

/**
 * @param exact true when the whole normalized description equals the rule pattern
 */
public record RegistryMatch(RegistryRule rule, boolean exact) {

    public double confidence() {
        return rule.confidence();
    }
}
