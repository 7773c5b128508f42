package com.spendlens.backend.services.statements.parsers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date-anchored line parser for bank statements whose text comes out one transaction per line:
 * {@code <date> <narration...> [amount [Cr|Dr]] [balance]}.
 */
public class GenericLineStatementParser implements StatementLayoutParser {

    // 1,234.56 | 1,23,456.00 | 1234 | -12.5
    private static final String NUMBER = "-?\\d{1,3}(?:,\\d{2,3})+(?:\\.\\d+)?|-?\\d+(?:\\.\\d+)?";
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("(?<!\\w)(" + NUMBER + ")(?!\\w)");
    private static final Pattern TAIL = Pattern.compile(
            "(?:\\s+(?:" + NUMBER + "|(?i:cr|dr)\\.?))+\\s*$");
    private static final Pattern CREDIT_MARKER = Pattern.compile("\\b(cr|credit)\\b");
    private static final Pattern DEBIT_MARKER = Pattern.compile("\\b(dr|debit)\\b");

    private static final int MIN_DESCRIPTION_LENGTH = 3;

    @Override
    public String name() {
        return "generic";
    }

    @Override
    public boolean isApplicable(List<String> lines) {
        return true;
    }

    @Override
    public List<StatementRow> parse(List<String> lines) {
        List<StatementRow> rows = new ArrayList<>();
        for (String line : lines) {
            Optional<LocalDate> date = StatementDates.find(line);
            if (date.isEmpty()) continue;

            String rest = " " + StatementDates.withoutDate(line);
            Matcher tail = TAIL.matcher(rest);
            String columns = tail.find() ? tail.group() : "";
            String description = columns.isEmpty() ? rest.trim() : rest.substring(0, tail.start()).trim();

            BigDecimal amount = amount(line, columns.isEmpty() ? rest : columns);
            if (amount == null) continue;
            if (description.length() < MIN_DESCRIPTION_LENGTH) continue;

            rows.add(new StatementRow(date.get(), description, amount, line));
        }
        return rows;
    }

    /**
     * A Cr/Dr marker right after a number fixes both the amount and its sign. Otherwise, with
     * two or more numbers the last one is the running balance and the nearest non-zero number
     * before it is the amount; the sign comes from a credit/debit word anywhere on the line.
     */
    static BigDecimal amount(String line, String columns) {
        List<String> tokens = List.of(columns.trim().split("\\s+"));
        List<BigDecimal> numbers = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            BigDecimal value = number(tokens.get(i));
            if (value == null) continue;
            String next = i + 1 < tokens.size() ? tokens.get(i + 1).toLowerCase(Locale.ROOT) : "";
            if (next.startsWith("cr")) return value.abs().negate();
            if (next.startsWith("dr")) return value.abs();
            numbers.add(value);
        }
        if (numbers.isEmpty()) {
            numbers = numericTokens(columns);
        }
        if (numbers.isEmpty()) return null;

        BigDecimal chosen = numbers.get(numbers.size() - 1).abs();
        if (numbers.size() >= 2) {
            for (int i = numbers.size() - 2; i >= 0; i--) {
                if (numbers.get(i).signum() != 0) {
                    chosen = numbers.get(i).abs();
                    break;
                }
            }
        }

        String lower = line.toLowerCase(Locale.ROOT);
        boolean credit = CREDIT_MARKER.matcher(lower).find();
        boolean debit = DEBIT_MARKER.matcher(lower).find();
        return credit && !debit ? chosen.negate() : chosen;
    }

    static List<BigDecimal> numericTokens(String text) {
        List<BigDecimal> out = new ArrayList<>();
        Matcher m = NUMERIC_TOKEN.matcher(text);
        while (m.find()) {
            BigDecimal value = number(m.group(1));
            if (value != null) out.add(value);
        }
        return out;
    }

    private static BigDecimal number(String token) {
        String t = token.replace(",", "");
        if (!t.matches("-?\\d+(?:\\.\\d+)?")) return null;
        return new BigDecimal(t);
    }
}
