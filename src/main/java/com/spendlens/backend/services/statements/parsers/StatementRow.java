package com.spendlens.backend.services.statements.parsers;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row read off a statement layout. Amount is signed: debit positive, credit negative.
 */
public record StatementRow(LocalDate date, String description, BigDecimal amount, String sourceLine) {

    public StatementRow withDescription(String newDescription) {
        return new StatementRow(date, newDescription, amount, sourceLine);
    }
}
