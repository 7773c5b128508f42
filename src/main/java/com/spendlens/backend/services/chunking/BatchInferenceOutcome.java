package com.spendlens.backend.services.chunking;

import java.util.List;

/**
 * Batch-mode results in input order. Empty when every chunk failed.
 */
public record BatchInferenceOutcome(List<InferredClassification> results, ChunkErrorSummary summary) {

    public BatchInferenceOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
