package com.spendlens.backend.services.classification;

import java.util.List;

import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.services.chunking.ChunkErrorSummary;

/**
 * @param results          accepted records, in input order
 * @param inferenceSummary null when batch inference was not used
 */
public record BatchClassificationResult(
        List<ClassificationResult> results,
        List<RejectedRecord> rejected,
        ChunkErrorSummary inferenceSummary
) {
    public BatchClassificationResult {
        results = results == null ? List.of() : List.copyOf(results);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }
}
