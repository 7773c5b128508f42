package com.spendlens.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.spendlens.backend.classification.entity.CustomCategory;
import com.spendlens.backend.classification.entity.CustomRuleType;

public record CustomCategoryResponseDTO(
        UUID id,
        String name,
        String description,
        List<String> tags,
        List<Rule> rules,
        boolean active,
        LocalDateTime createdAt
) {
    public record Rule(CustomRuleType type, String value, BigDecimal minAmount, BigDecimal maxAmount,
                       int priority, boolean exclusive) {
    }

    public static CustomCategoryResponseDTO from(CustomCategory c) {
        return new CustomCategoryResponseDTO(
                c.getId(),
                c.getName(),
                c.getDescription(),
                List.copyOf(c.getTags()),
                c.getRules().stream()
                        .map(r -> new Rule(r.getType(), r.getValue(), r.getMinAmount(), r.getMaxAmount(),
                                r.getPriority(), r.isExclusive()))
                        .toList(),
                c.isActive(),
                c.getCreatedAt());
    }
}
