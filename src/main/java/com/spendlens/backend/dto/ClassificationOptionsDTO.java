package com.spendlens.backend.dto;

import com.spendlens.backend.classification.model.ClassificationOptions;
import com.spendlens.backend.config.ClassificationProperties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * Every field is optional; missing ones take the configured defaults.
 */
public record ClassificationOptionsDTO(
        Boolean enableLlmFallback,
        @DecimalMin(value = "0.0", message = "lowConfidenceThreshold must be >= 0")
        @DecimalMax(value = "1.0", message = "lowConfidenceThreshold must be <= 1")
        Double lowConfidenceThreshold,
        Boolean useLlmOnly
) {
    public static ClassificationOptions resolve(ClassificationOptionsDTO dto, ClassificationProperties properties) {
        ClassificationOptions defaults = ClassificationOptions.from(properties);
        if (dto == null) return defaults;
        return new ClassificationOptions(
                dto.enableLlmFallback() != null ? dto.enableLlmFallback() : defaults.enableLlmFallback(),
                dto.lowConfidenceThreshold() != null ? dto.lowConfidenceThreshold() : defaults.lowConfidenceThreshold(),
                dto.useLlmOnly() != null ? dto.useLlmOnly() : defaults.useLlmOnly());
    }
}
