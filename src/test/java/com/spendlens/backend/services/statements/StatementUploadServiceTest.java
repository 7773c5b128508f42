package com.spendlens.backend.services.statements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.services.statements.parsers.CsvTransactionParser;

@ExtendWith(MockitoExtension.class)
class StatementUploadServiceTest {

    @Mock
    private PdfTextExtractor pdfTextExtractor;

    @Mock
    private StatementExtractionPipeline pipeline;

    private StatementUploadService service;

    @BeforeEach
    void setUp() {
        service = new StatementUploadService(pdfTextExtractor, new CsvTransactionParser(new ObjectMapper()), pipeline);
    }

    @Test
    void pdfByMagicBytes_goesThroughPipeline() {
        byte[] bytes = "%PDF-1.4 fake".getBytes(StandardCharsets.US_ASCII);
        StatementParseResult parsed = new StatementParseResult(List.of(), ExtractionPath.STRUCTURAL, 0, null);
        when(pdfTextExtractor.extractText(bytes, "secret")).thenReturn("01/01/2024 X 1.00");
        when(pipeline.parseStatement("01/01/2024 X 1.00")).thenReturn(parsed);

        UploadedStatement uploaded = service.upload(
                new MockMultipartFile("file", "statement.bin", "application/octet-stream", bytes), "secret");

        assertEquals("pdf", uploaded.fileType());
        assertSame(parsed, uploaded.extraction());
    }

    @Test
    void csvByExtension_skipsPipeline() {
        byte[] csv = "description,amount\nZOMATO,450\nNO AMOUNT,\n".getBytes(StandardCharsets.UTF_8);

        UploadedStatement uploaded = service.upload(new MockMultipartFile("file", "export.CSV", null, csv), null);

        assertEquals("csv", uploaded.fileType());
        assertEquals(1, uploaded.extraction().transactions().size());
        assertEquals(1, uploaded.skippedRows());
        verify(pipeline, never()).parseStatement(any());
    }

    @Test
    void unsupportedOrEmptyFile_rejected() {
        assertThrows(InvalidInputException.class, () -> service.upload(
                new MockMultipartFile("file", "photo.png", "image/png", new byte[] {1, 2, 3}), null));
        assertThrows(InvalidInputException.class, () -> service.upload(
                new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]), null));
        assertThrows(InvalidInputException.class, () -> service.upload(null, null));
    }
}
