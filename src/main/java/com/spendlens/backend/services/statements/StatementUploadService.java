package com.spendlens.backend.services.statements;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.services.statements.parsers.CsvParseResult;
import com.spendlens.backend.services.statements.parsers.CsvTransactionParser;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accepts statement files. PDFs are converted to text and run through the extraction pipeline;
 * CSV exports are already tabular and go straight to the CSV parser.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatementUploadService {

    private final PdfTextExtractor pdfTextExtractor;
    private final CsvTransactionParser csvTransactionParser;
    private final StatementExtractionPipeline pipeline;

    public UploadedStatement upload(MultipartFile file, String password) {
        if (file == null || file.isEmpty()) {
            throw new InvalidInputException("File is missing or empty");
        }

        String filename = file.getOriginalFilename() == null ? "" : file.getOriginalFilename().toLowerCase(Locale.ROOT);
        byte[] bytes;
        try (InputStream is = file.getInputStream()) {
            bytes = is.readAllBytes();
        } catch (IOException e) {
            throw new InvalidInputException("Could not read uploaded file: " + e.getMessage());
        }

        if (filename.endsWith(".pdf") || isPdf(bytes)) {
            String text = pdfTextExtractor.extractText(bytes, password);
            return new UploadedStatement("pdf", pipeline.parseStatement(text), 0);
        }
        if (filename.endsWith(".csv") || "text/csv".equalsIgnoreCase(file.getContentType())) {
            CsvParseResult csv = csvTransactionParser.parse(new String(bytes, StandardCharsets.UTF_8));
            log.info("[Statement] CSV upload: {} rows, {} skipped", csv.transactions().size(), csv.skippedRows());
            StatementParseResult extraction = new StatementParseResult(
                    csv.transactions(), ExtractionPath.STRUCTURAL, csv.transactions().size(), null);
            return new UploadedStatement("csv", extraction, csv.skippedRows());
        }
        throw new InvalidInputException("Only PDF and CSV statements are supported");
    }

    private static boolean isPdf(byte[] bytes) {
        return bytes.length >= 5 && bytes[0] == '%' && bytes[1] == 'P' && bytes[2] == 'D' && bytes[3] == 'F' && bytes[4] == '-';
    }
}
