package com.spendlens.backend.classification.custom;

import java.math.BigDecimal;
import java.util.List;

import com.spendlens.backend.classification.entity.CustomRuleType;

/**
 * Input for {@link CustomCategoryMatcher#create(CustomCategoryCommand)}. Null priority means 5.
 */
public record CustomCategoryCommand(String name, String description, List<String> tags, List<Rule> rules) {

    public CustomCategoryCommand {
        tags = tags == null ? List.of() : List.copyOf(tags);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public record Rule(CustomRuleType type, String value, BigDecimal minAmount, BigDecimal maxAmount,
                       Integer priority, boolean exclusive) {
    }
}
