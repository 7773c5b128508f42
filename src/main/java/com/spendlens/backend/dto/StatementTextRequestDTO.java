package com.spendlens.backend.dto;

import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.services.classification.BatchOptions;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Raw statement text. The batch fields only apply to the analyze endpoint.
 */
public record StatementTextRequestDTO(
        @NotBlank(message = "text is required")
        String text,
        @Min(value = 0, message = "chunkSize must be >= 0")
        Integer chunkSize,
        Boolean useLlmChunked,
        @Valid
        ClassificationOptionsDTO options
) {
    public BatchOptions toBatchOptions(ClassificationProperties properties) {
        return BatchClassifyRequestDTO.batchOptions(chunkSize, useLlmChunked, options, properties);
    }
}
