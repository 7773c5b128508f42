package com.spendlens.backend.services.statements;

import org.springframework.stereotype.Service;

import com.spendlens.backend.services.classification.BatchClassificationService;
import com.spendlens.backend.services.classification.BatchOptions;

import lombok.RequiredArgsConstructor;

/**
 * Extraction followed by batch classification of every extracted row.
 */
@Service
@RequiredArgsConstructor
public class StatementAnalysisService {

    private final StatementExtractionPipeline pipeline;
    private final BatchClassificationService batchClassificationService;

    public StatementAnalysis analyze(String rawText, BatchOptions options) {
        StatementParseResult extraction = pipeline.parseStatement(rawText);
        return new StatementAnalysis(extraction,
                batchClassificationService.classifyBatch(extraction.transactions(), options));
    }
}
