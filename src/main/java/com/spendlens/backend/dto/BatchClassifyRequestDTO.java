package com.spendlens.backend.dto;

import java.util.List;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.services.classification.BatchOptions;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record BatchClassifyRequestDTO(
        @NotNull(message = "transactions is required")
        List<TransactionRequestDTO> transactions,
        @Min(value = 0, message = "chunkSize must be >= 0")
        Integer chunkSize,
        Boolean useLlmChunked,
        @Valid
        ClassificationOptionsDTO options
) {
    public List<Transaction> toTransactions() {
        return transactions.stream().map(t -> t == null ? null : t.toTransaction()).toList();
    }

    public BatchOptions toBatchOptions(ClassificationProperties properties) {
        return batchOptions(chunkSize, useLlmChunked, options, properties);
    }

    static BatchOptions batchOptions(Integer chunkSize, Boolean useLlmChunked,
                                     ClassificationOptionsDTO options, ClassificationProperties properties) {
        return new BatchOptions(
                chunkSize != null ? chunkSize : 0,
                useLlmChunked == null || useLlmChunked,
                ClassificationOptionsDTO.resolve(options, properties));
    }
}
