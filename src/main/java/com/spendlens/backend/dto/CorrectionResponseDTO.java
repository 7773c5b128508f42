package com.spendlens.backend.dto;

import java.time.LocalDateTime;

import com.spendlens.backend.classification.entity.CategoryCorrection;

public record CorrectionResponseDTO(
        Long id,
        String transactionId,
        String description,
        String merchantName,
        String patternKey,
        String oldCategory,
        String newCategory,
        String newSubcategory,
        LocalDateTime createdAt
) {
    public static CorrectionResponseDTO from(CategoryCorrection c) {
        return new CorrectionResponseDTO(
                c.getId(),
                c.getTransactionId(),
                c.getDescription(),
                c.getMerchantName(),
                c.getPatternKey(),
                c.getOldCategory(),
                c.getNewCategory(),
                c.getNewSubcategory(),
                c.getCreatedAt());
    }
}
