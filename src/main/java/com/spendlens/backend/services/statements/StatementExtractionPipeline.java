package com.spendlens.backend.services.statements;

import java.util.List;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.config.StatementProperties;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.services.chunking.ChunkedInferenceOrchestrator;
import com.spendlens.backend.services.chunking.TextExtractionOutcome;
import com.spendlens.backend.services.statements.parsers.StructuralStatementParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns statement text into transactions. Structural parsing always runs first; the inference
 * fallback only runs when it found too few rows in a text long enough to hold more. Extraction
 * only: categorising is left to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementExtractionPipeline {

    private final StructuralStatementParser structuralParser;
    private final ChunkedInferenceOrchestrator orchestrator;
    private final StatementProperties properties;

    public StatementParseResult parseStatement(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new InvalidInputException("statement text is required");
        }

        List<Transaction> structural = structuralParser.parse(rawText);
        int rows = structural.size();

        if (!shouldFallBack(rows, rawText.length())) {
            log.info("[Statement] Structural extraction: {} rows from {} chars", rows, rawText.length());
            return new StatementParseResult(structural, ExtractionPath.STRUCTURAL, rows, null);
        }

        log.info("[Statement] Structural extraction found {} rows in {} chars, trying inference fallback",
                rows, rawText.length());
        TextExtractionOutcome outcome = orchestrator.extractTransactions(rawText);

        if (outcome.transactions().isEmpty()) {
            log.warn("[Statement] Inference fallback returned no rows, keeping {} structural rows", rows);
            return new StatementParseResult(structural, ExtractionPath.STRUCTURAL_AFTER_FAILED_FALLBACK,
                    rows, outcome.summary());
        }

        ExtractionPath path = outcome.chunked() ? ExtractionPath.INFERENCE_CHUNKED : ExtractionPath.INFERENCE_SINGLE;
        log.info("[Statement] {} extraction: {} rows", path, outcome.transactions().size());
        return new StatementParseResult(outcome.transactions(), path, rows, outcome.summary());
    }

    boolean shouldFallBack(int structuralRows, int textLength) {
        return structuralRows < properties.getMinRowCountForStructuralSuccess()
                && textLength > properties.getMinTextLengthForFallback()
                && orchestrator.isAvailable();
    }
}
