package com.spendlens.backend.services.statements;

import com.spendlens.backend.services.classification.BatchClassificationResult;

public record StatementAnalysis(StatementParseResult extraction, BatchClassificationResult classification) {
}
