package com.spendlens.backend.dto;

import java.util.List;

import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.services.chunking.ChunkErrorSummary;
import com.spendlens.backend.services.classification.RejectedRecord;
import com.spendlens.backend.services.statements.ExtractionPath;
import com.spendlens.backend.services.statements.StatementAnalysis;

public record StatementAnalysisResponseDTO(
        ExtractionPath path,
        List<Transaction> transactions,
        List<ClassificationResult> results,
        List<RejectedRecord> rejected,
        ChunkErrorSummary extractionErrors,
        ChunkErrorSummary classificationErrors
) {
    public static StatementAnalysisResponseDTO from(StatementAnalysis analysis) {
        return new StatementAnalysisResponseDTO(
                analysis.extraction().path(),
                analysis.extraction().transactions(),
                analysis.classification().results(),
                analysis.classification().rejected(),
                analysis.extraction().errorSummary(),
                analysis.classification().inferenceSummary());
    }
}
