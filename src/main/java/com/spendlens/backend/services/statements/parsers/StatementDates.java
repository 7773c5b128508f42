package com.spendlens.backend.services.statements.parsers;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date formats seen on Indian bank and wallet statements.
 */
public final class StatementDates {

    private StatementDates() {
    }

    private record DateFormat(DateTimeFormatter formatter, Pattern pattern) {
    }

    // Ordem importa: dd/MM/yyyy antes de dd/MM/yy.
    private static final List<DateFormat> FORMATS = List.of(
            new DateFormat(formatter("d/M/uuuu"), Pattern.compile("\\b(\\d{1,2}/\\d{1,2}/\\d{4})\\b")),
            new DateFormat(formatter("d/M/uu"), Pattern.compile("\\b(\\d{1,2}/\\d{1,2}/\\d{2})\\b")),
            new DateFormat(formatter("d-MMM-uu"), Pattern.compile("\\b(\\d{1,2}-[A-Za-z]{3}-\\d{2})\\b")),
            new DateFormat(formatter("d-MMM-uuuu"), Pattern.compile("\\b(\\d{1,2}-[A-Za-z]{3}-\\d{4})\\b")),
            new DateFormat(formatter("MMM d, uuuu"), Pattern.compile("\\b([A-Za-z]{3}\\s+\\d{1,2},\\s+\\d{4})\\b"))
    );

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    /**
     * Parses a single date token in any supported format.
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.trim().replaceAll("\\s+", " ");
        for (DateFormat f : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(s, f.formatter()));
            } catch (DateTimeParseException ignored) {
                // tenta o próximo formato
            }
        }
        return Optional.empty();
    }

    /**
     * The line with its first recognised date removed, or the line unchanged when it has none.
     */
    public static String withoutDate(String line) {
        if (line == null) return "";
        for (DateFormat f : FORMATS) {
            Matcher m = f.pattern().matcher(line);
            if (m.find() && parse(m.group(1)).isPresent()) {
                return (line.substring(0, m.start()) + " " + line.substring(m.end())).trim();
            }
        }
        return line;
    }

    /**
     * First date found anywhere in the line.
     */
    public static Optional<LocalDate> find(String line) {
        if (line == null || line.isBlank()) return Optional.empty();
        for (DateFormat f : FORMATS) {
            Matcher m = f.pattern().matcher(line);
            if (m.find()) {
                Optional<LocalDate> parsed = parse(m.group(1));
                if (parsed.isPresent()) return parsed;
            }
        }
        return Optional.empty();
    }
}
