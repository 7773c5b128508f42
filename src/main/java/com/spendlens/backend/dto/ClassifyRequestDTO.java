package com.spendlens.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ClassifyRequestDTO(
        @NotNull(message = "transaction is required")
        @Valid
        TransactionRequestDTO transaction,
        @Valid
        ClassificationOptionsDTO options
) {}
