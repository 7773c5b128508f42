package com.spendlens.backend.dto;

import java.util.List;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.services.chunking.ChunkErrorSummary;
import com.spendlens.backend.services.statements.ExtractionPath;
import com.spendlens.backend.services.statements.StatementParseResult;
import com.spendlens.backend.services.statements.UploadedStatement;

public record StatementParseResponseDTO(
        String fileType,
        ExtractionPath path,
        int count,
        int structuralCount,
        int skippedRows,
        List<Transaction> transactions,
        ChunkErrorSummary errorSummary
) {
    public static StatementParseResponseDTO from(StatementParseResult r) {
        return new StatementParseResponseDTO("text", r.path(), r.transactions().size(), r.structuralCount(), 0,
                r.transactions(), r.errorSummary());
    }

    public static StatementParseResponseDTO from(UploadedStatement upload) {
        StatementParseResult r = upload.extraction();
        return new StatementParseResponseDTO(upload.fileType(), r.path(), r.transactions().size(), r.structuralCount(),
                upload.skippedRows(), r.transactions(), r.errorSummary());
    }
}
