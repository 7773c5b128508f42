package com.spendlens.backend.classification.stages;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.registry.MerchantRuleRegistry;
import com.spendlens.backend.classification.registry.RegistryMatch;
import com.spendlens.backend.classification.registry.RegistryRule;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class RuleStage implements ClassificationStage {

    private final MerchantRuleRegistry registry;

    @Override
    public String name() {
        return "rule";
    }

    @Override
    public Optional<StageDecision> evaluate(StageContext context) {
        if (context.getOptions().useLlmOnly()) return Optional.empty();

        Optional<RegistryMatch> match;
        try {
            match = registry.lookup(context.getTransaction().description());
        } catch (RegistryUnavailableException e) {
            context.setRegistryDegraded(true);
            log.warn("[Classify] Registry unavailable, running in degraded mode without rules: {}", e.getMessage());
            return Optional.empty();
        }

        if (match.isEmpty()) return Optional.empty();

        RegistryMatch m = match.get();
        RegistryRule rule = m.rule();
        if (m.confidence() < context.getOptions().lowConfidenceThreshold()) {
            context.setPartialRule(m);
            return Optional.empty();
        }

        return Optional.of(new StageDecision(
                rule.category(),
                rule.subcategory(),
                rule.merchantName(),
                CategorizationMethod.RULE,
                m.confidence(),
                (m.exact() ? "Exact" : "Contained") + " " + (rule.isLearned() ? "learned" : "seed") + " rule '" + rule.pattern() + "'"
        ));
    }
}
