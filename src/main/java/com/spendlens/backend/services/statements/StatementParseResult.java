package com.spendlens.backend.services.statements;

import java.util.List;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.services.chunking.ChunkErrorSummary;

/**
 * @param structuralCount rows the structural parser found, whichever path won
 * @param errorSummary    chunk failures of the inference fallback, null when it did not run
 */
public record StatementParseResult(
        List<Transaction> transactions,
        ExtractionPath path,
        int structuralCount,
        ChunkErrorSummary errorSummary
) {
    public StatementParseResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
