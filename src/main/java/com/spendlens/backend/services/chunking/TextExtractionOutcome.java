package com.spendlens.backend.services.chunking;

import java.util.List;

import com.spendlens.backend.classification.model.Transaction;

/**
 * @param chunked false when the text went out as a single call
 */
public record TextExtractionOutcome(List<Transaction> transactions, ChunkErrorSummary summary, boolean chunked) {

    public TextExtractionOutcome {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
