package com.spendlens.backend.dto;

import java.math.BigDecimal;
import java.util.List;

import com.spendlens.backend.classification.custom.CustomCategoryCommand;
import com.spendlens.backend.classification.entity.CustomRuleType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CustomCategoryRequestDTO(
        @NotBlank(message = "name is required")
        @Size(max = 120, message = "name is too long")
        String name,
        @Size(max = 500, message = "description is too long")
        String description,
        List<String> tags,
        @NotEmpty(message = "at least one rule is required")
        List<@Valid RuleDTO> rules
) {
    public record RuleDTO(
            @NotNull(message = "type is required")
            CustomRuleType type,
            @Size(max = 255, message = "value is too long")
            String value,
            BigDecimal minAmount,
            BigDecimal maxAmount,
            @Min(value = 1, message = "priority must be between 1 and 10")
            @Max(value = 10, message = "priority must be between 1 and 10")
            Integer priority,
            Boolean exclusive
    ) {
    }

    public CustomCategoryCommand toCommand() {
        return new CustomCategoryCommand(name, description, tags, rules.stream()
                .map(r -> new CustomCategoryCommand.Rule(r.type(), r.value(), r.minAmount(), r.maxAmount(),
                        r.priority(), Boolean.TRUE.equals(r.exclusive())))
                .toList());
    }
}
