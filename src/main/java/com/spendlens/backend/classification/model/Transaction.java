package com.spendlens.backend.classification.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A transaction as accepted into the pipeline.
 *
 * Sign convention: positive amounts are debits (money out), negative amounts are credits.
 */
public record Transaction(
        String id,
        LocalDate date,
        String description,
        BigDecimal amount,
        List<LineItem> lineItems
) {
    public Transaction {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }

    public Transaction(String id, LocalDate date, String description, BigDecimal amount) {
        this(id, date, description, amount, List.of());
    }

    public boolean isCredit() {
        return amount != null && amount.signum() < 0;
    }

    public boolean hasLineItems() {
        return !lineItems.isEmpty();
    }
}
