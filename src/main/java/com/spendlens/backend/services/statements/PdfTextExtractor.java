package com.spendlens.backend.services.statements;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import com.spendlens.backend.exceptions.InvalidInputException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class PdfTextExtractor {

    static final int MAX_PAGES = 20;

    /**
     * Text of the first pages of the PDF. Position-sorted extraction is tried first since it
     * keeps table rows on one line more often; the plain stripper is the fallback.
     */
    public String extractText(byte[] pdfBytes, String password) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new InvalidInputException("PDF file is empty");
        }

        String text;
        try (PDDocument document = (password != null && !password.isBlank())
                ? PDDocument.load(new ByteArrayInputStream(pdfBytes), password)
                : PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            document.setAllSecurityToBeRemoved(true);

            text = extract(document, true);
            if (text == null || text.isBlank()) {
                text = extract(document, false);
            }
        } catch (InvalidPasswordException e) {
            throw new InvalidInputException(password != null && !password.isBlank()
                    ? "Wrong password for PDF file"
                    : "PDF file is password protected");
        } catch (IOException e) {
            throw new InvalidInputException("Could not read PDF file: " + e.getMessage());
        }

        if (text == null || text.isBlank()) {
            throw new InvalidInputException("No text could be extracted from the PDF. It may be a scanned image.");
        }
        log.info("[Statement] Extracted {} chars from PDF", text.length());
        return text;
    }

    private static String extract(PDDocument document, boolean sortByPosition) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(sortByPosition);
        stripper.setStartPage(1);
        stripper.setEndPage(Math.min(MAX_PAGES, document.getNumberOfPages()));
        return stripper.getText(document);
    }
}
