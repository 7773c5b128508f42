package com.spendlens.backend.classification.entity;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomCategoryRule {

    @Enumerated(EnumType.STRING)
    @Column(name = "rule_type", nullable = false, length = 24)
    private CustomRuleType type;

    /** Keyword, merchant, regex, day name or category; unused by the amount rules. */
    @Column(name = "rule_value", length = 255)
    private String value;

    @Column(name = "min_amount", precision = 19, scale = 2)
    private BigDecimal minAmount;

    @Column(name = "max_amount", precision = 19, scale = 2)
    private BigDecimal maxAmount;

    /** 1 is the strongest, 10 the weakest. */
    @Column(nullable = false)
    private int priority;

    /** When matched, the remaining rules of the category are not evaluated. */
    @Column(name = "exclusive_match", nullable = false)
    private boolean exclusive;
}
