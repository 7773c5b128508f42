package com.spendlens.backend.dto;

import com.spendlens.backend.classification.feedback.CorrectionCommand;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CorrectionRequestDTO(
        String transactionId,
        @Size(max = 2000, message = "description is too long")
        String description,
        String merchantName,
        String oldCategory,
        @NotBlank(message = "newCategory is required")
        String newCategory,
        String newSubcategory
) {
    public CorrectionCommand toCommand() {
        return new CorrectionCommand(transactionId, description, merchantName, oldCategory, newCategory, newSubcategory);
    }
}
