package com.spendlens.backend.classification.feedback;

public record CorrectionCommand(
        String transactionId,
        String description,
        String merchantName,
        String oldCategory,
        String newCategory,
        String newSubcategory
) {
}
