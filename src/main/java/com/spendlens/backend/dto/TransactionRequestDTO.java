package com.spendlens.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import com.spendlens.backend.classification.model.LineItem;
import com.spendlens.backend.classification.model.Transaction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Constraints are enforced on single-transaction endpoints only; in batches each record is
 * checked by the service and rejected on its own.
 */
public record TransactionRequestDTO(
        @NotBlank(message = "transactionId is required")
        String transactionId,
        LocalDate date,
        String description,
        @NotNull(message = "amount is required")
        BigDecimal amount,
        List<LineItemDTO> lineItems
) {
    public Transaction toTransaction() {
        List<LineItem> items = lineItems == null ? List.of()
                : lineItems.stream().filter(Objects::nonNull).map(LineItemDTO::toLineItem).toList();
        return new Transaction(transactionId, date, description, amount, items);
    }
}
