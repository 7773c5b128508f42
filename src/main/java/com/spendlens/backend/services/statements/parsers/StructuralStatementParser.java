package com.spendlens.backend.services.statements.parsers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.model.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Cheap regex-based extraction. Picks the first applicable layout, the generic line parser
 * being the last resort, and numbers the rows {@code PDF_00001}, {@code PDF_00002}... in
 * document order.
 */
@Slf4j
@Component
public class StructuralStatementParser {

    private final List<StatementLayoutParser> layouts;

    public StructuralStatementParser() {
        this.layouts = List.of(
                new PhonePeStatementParser(),
                new GenericLineStatementParser()
        );
    }

    public List<Transaction> parse(String text) {
        List<String> lines = lines(text);
        if (lines.isEmpty()) return List.of();

        StatementLayoutParser layout = select(lines);
        List<StatementRow> rows = layout.parse(lines);

        List<Transaction> out = new ArrayList<>(rows.size());
        int seq = 1;
        for (StatementRow row : rows) {
            out.add(new Transaction(String.format("PDF_%05d", seq++), row.date(), row.description(), row.amount()));
        }
        log.debug("[Statement] Layout '{}' produced {} rows from {} lines", layout.name(), out.size(), lines.size());
        return out;
    }

    StatementLayoutParser select(List<String> lines) {
        for (StatementLayoutParser layout : layouts) {
            try {
                if (layout.isApplicable(lines)) return layout;
            } catch (RuntimeException e) {
                log.warn("[Statement] Layout '{}' detection failed: {}", layout.name(), e.getMessage());
            }
        }
        return layouts.get(layouts.size() - 1);
    }

    static List<String> lines(String text) {
        if (text == null || text.isBlank()) return List.of();
        return Arrays.stream(text.replace('\u00A0', ' ').split("\\R"))
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .toList();
    }
}
