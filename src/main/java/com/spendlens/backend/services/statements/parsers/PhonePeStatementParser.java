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
 * PhonePe wallet statements. Each transaction is a row
 * {@code Feb 27, 2026 Paid to XYZ DEBIT ₹150} followed by a time line carrying the
 * {@code Transaction ID} and, for long merchant names, a wrapped description line.
 */
public class PhonePeStatementParser implements StatementLayoutParser {

    private static final Pattern ROW = Pattern.compile(
            "^((?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+\\d{1,2},\\s+\\d{4})\\s+(.+?)\\s+(DEBIT|CREDIT)\\s+₹\\s*([\\d,]+(?:\\.\\d+)?)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRANSACTION_ID = Pattern.compile("\\bTransaction ID\\s+([A-Za-z0-9]+)\\b");
    private static final Pattern TIME_ONLY = Pattern.compile("^\\d{1,2}:\\d{2}(?:\\s*[ap]m)?$", Pattern.CASE_INSENSITIVE);

    private static final List<String> NOT_CONTINUATION_PREFIXES = List.of(
            "utr no", "paid by", "credited to", "jio prepaid reference id", "vi prepaid reference id");
    private static final int MAX_CONTINUATION_LENGTH = 140;

    @Override
    public String name() {
        return "phonepe";
    }

    @Override
    public boolean isApplicable(List<String> lines) {
        String head = String.join("\n", lines.subList(0, Math.min(120, lines.size()))).toLowerCase(Locale.ROOT);
        if (head.contains("support.phonepe.com/statement")) return true;
        if (head.contains("transaction statement for")) return true;

        boolean hasTransactionIds = lines.stream().limit(200)
                .anyMatch(l -> l.toLowerCase(Locale.ROOT).contains("transaction id"));
        boolean hasRupeeRows = lines.stream().limit(400)
                .map(l -> l.toLowerCase(Locale.ROOT))
                .anyMatch(l -> (l.contains("debit") || l.contains("credit")) && l.contains("₹"));
        return hasTransactionIds && hasRupeeRows;
    }

    @Override
    public List<StatementRow> parse(List<String> lines) {
        List<StatementRow> rows = new ArrayList<>();
        StatementRow last = null;

        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.startsWith("page ") || lower.startsWith("-- ") || lower.startsWith("date transaction details")) {
                continue;
            }
            if (lower.contains("system generated statement") || lower.contains("support.phonepe.com/statement")) {
                continue;
            }

            Matcher row = ROW.matcher(line);
            if (row.matches()) {
                Optional<LocalDate> date = StatementDates.parse(row.group(1));
                if (date.isEmpty()) continue;

                BigDecimal amount;
                try {
                    amount = new BigDecimal(row.group(4).replace(",", ""));
                } catch (NumberFormatException e) {
                    continue;
                }
                if ("CREDIT".equalsIgnoreCase(row.group(3))) {
                    amount = amount.negate();
                }

                last = new StatementRow(date.get(), row.group(2).trim(), amount, line);
                rows.add(last);
                continue;
            }

            // linha de horário com o Transaction ID: não faz parte da descrição
            if (TRANSACTION_ID.matcher(line).find() || TIME_ONLY.matcher(line).matches()) {
                continue;
            }

            if (last != null && isContinuation(lower, line)) {
                last = last.withDescription(last.description() + " " + line);
                rows.set(rows.size() - 1, last);
            }
        }
        return rows;
    }

    private static boolean isContinuation(String lower, String line) {
        for (String prefix : NOT_CONTINUATION_PREFIXES) {
            if (lower.startsWith(prefix)) return false;
        }
        return line.length() <= MAX_CONTINUATION_LENGTH;
    }
}
