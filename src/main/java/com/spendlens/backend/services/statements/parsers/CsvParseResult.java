package com.spendlens.backend.services.statements.parsers;

import java.util.List;

import com.spendlens.backend.classification.model.Transaction;

public record CsvParseResult(List<Transaction> transactions, int skippedRows) {

    public CsvParseResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
