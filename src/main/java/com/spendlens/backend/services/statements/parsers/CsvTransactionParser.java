package com.spendlens.backend.services.statements.parsers;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.classification.model.LineItem;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;

import lombok.extern.slf4j.Slf4j;

/**
 * Parses uploaded CSV exports. Headers are matched case-insensitively:
 * <ul>
 *     <li>id: {@code transaction_id}, {@code id} (defaults to {@code ROW_n})</li>
 *     <li>date: {@code date}, {@code txn_date}, {@code transaction_date}</li>
 *     <li>description: {@code description}, {@code narration}, {@code remarks}, {@code particulars}</li>
 *     <li>amount: {@code amount}, or separate {@code debit} / {@code credit} columns</li>
 *     <li>{@code line_items}: optional JSON array of {@code {"name","amount"}}</li>
 * </ul>
 * Rows without a usable amount are skipped and counted.
 */
@Slf4j
@Component
public class CsvTransactionParser {

    private static final List<String> ID_COLUMNS = List.of("transaction_id", "id");
    private static final List<String> DATE_COLUMNS = List.of("date", "txn_date", "transaction_date");
    private static final List<String> DESCRIPTION_COLUMNS = List.of("description", "narration", "remarks", "particulars");

    private static final TypeReference<List<LineItem>> LINE_ITEMS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CsvTransactionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CsvParseResult parse(String csvText) {
        if (csvText == null || csvText.isBlank()) {
            throw new InvalidInputException("CSV content is empty");
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreHeaderCase(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();

        List<Transaction> out = new ArrayList<>();
        int skipped = 0;

        try (CSVParser parser = CSVParser.parse(new StringReader(csvText.strip()), format)) {
            int row = 0;
            for (CSVRecord record : parser) {
                row++;
                Optional<Transaction> tx = toTransaction(record, row);
                if (tx.isPresent()) {
                    out.add(tx.get());
                } else {
                    skipped++;
                }
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidInputException("Malformed CSV: " + e.getMessage());
        }

        if (skipped > 0) {
            log.info("[Statement] CSV parsed: {} rows, {} skipped", out.size(), skipped);
        }
        return new CsvParseResult(out, skipped);
    }

    private Optional<Transaction> toTransaction(CSVRecord record, int row) {
        BigDecimal amount = amount(record);
        if (amount == null) return Optional.empty();

        String id = first(record, ID_COLUMNS);
        String description = first(record, DESCRIPTION_COLUMNS);
        LocalDate date = date(first(record, DATE_COLUMNS));

        return Optional.of(new Transaction(
                id != null ? id : "ROW_" + row,
                date,
                description != null ? description : "",
                amount,
                lineItems(value(record, "line_items"), row)));
    }

    private static BigDecimal amount(CSVRecord record) {
        BigDecimal amount = number(value(record, "amount"));
        if (amount != null) return amount;

        BigDecimal debit = number(value(record, "debit"));
        BigDecimal credit = number(value(record, "credit"));
        if (debit != null && debit.signum() != 0) return debit.abs();
        if (credit != null && credit.signum() != 0) return credit.abs().negate();
        if (debit != null) return debit;
        return credit;
    }

    private List<LineItem> lineItems(String json, int row) {
        if (json == null) return List.of();
        try {
            List<LineItem> items = objectMapper.readValue(json, LINE_ITEMS);
            return items == null ? List.of() : items;
        } catch (JsonProcessingException e) {
            log.debug("[Statement] CSV row {} has unreadable line_items, ignoring them", row);
            return List.of();
        }
    }

    static LocalDate date(String raw) {
        if (raw == null) return null;
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return StatementDates.parse(raw).orElse(null);
        }
    }

    static BigDecimal number(String raw) {
        if (raw == null) return null;
        String cleaned = raw.replace(",", "").replace("₹", "").replaceAll("(?i)^rs\\.?", "").trim();
        if (cleaned.startsWith("(") && cleaned.endsWith(")")) {
            cleaned = "-" + cleaned.substring(1, cleaned.length() - 1);
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String first(CSVRecord record, List<String> columns) {
        for (String column : columns) {
            String v = value(record, column);
            if (v != null) return v;
        }
        return null;
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) return null;
        String v = record.get(column);
        return v == null || v.isBlank() ? null : v.trim();
    }
}
