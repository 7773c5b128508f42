package com.spendlens.backend.services.statements;

/**
 * Result of a file upload: the extraction plus, for CSV files, the rows that were skipped.
 */
public record UploadedStatement(String fileType, StatementParseResult extraction, int skippedRows) {
}
