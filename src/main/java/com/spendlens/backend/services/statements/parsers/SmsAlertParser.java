package com.spendlens.backend.services.statements.parsers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;

/**
 * Turns bank debit/credit SMS alerts into a transaction.
 *
 * <pre>
 * HDFC Bank: Rs.450.00 debited from A/c XX1234 on 15-Jan-24 to VPA ZOMATO@ICICI Ref No 456789
 * SBI: Your A/c XX5678 is debited by Rs.1,200.00 on 16/01/24 to BIGBASKET ORDER.
 * </pre>
 */
@Component
public class SmsAlertParser {

    private static final Pattern AMOUNT = Pattern.compile("Rs\\.?\\s?([\\d,]+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private static final Pattern HDFC_PAYEE = Pattern.compile("to (?:VPA )?([A-Z0-9@]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HDFC_DATE = Pattern.compile("on (\\d{2}-\\w{3}-\\d{2}|\\d{2}/\\d{2}/\\d{2,4})", Pattern.CASE_INSENSITIVE);

    private static final Pattern SBI_PAYEE = Pattern.compile(
            "\\bto\\b\\s+(.+?)(?:\\.|Available|Avl|Bal|Ref|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SBI_DATE = Pattern.compile("on (\\d{1,2}/\\d{1,2}/\\d{2,4})", Pattern.CASE_INSENSITIVE);

    private static final Pattern CREDITED = Pattern.compile("\\bcredited\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEBITED = Pattern.compile("\\bdebited\\b", Pattern.CASE_INSENSITIVE);

    private static final int FALLBACK_DESCRIPTION_LENGTH = 60;

    private final Clock clock;

    @Autowired
    public SmsAlertParser() {
        this(Clock.systemDefaultZone());
    }

    SmsAlertParser(Clock clock) {
        this.clock = clock;
    }

    public Transaction parse(String sms, SmsBank bank) {
        if (sms == null || sms.isBlank()) {
            throw new InvalidInputException("sms is required");
        }
        String text = sms.trim();
        SmsBank effective = bank == null || bank == SmsBank.GENERIC ? detect(text) : bank;

        String description;
        LocalDate date;
        if (effective == SmsBank.SBI) {
            Matcher payee = SBI_PAYEE.matcher(text);
            description = payee.find() ? payee.group(1).trim() : fallbackDescription(text);
            date = date(SBI_DATE, text);
        } else {
            // HDFC e genérico usam o mesmo formato "to VPA X@BANCO"
            Matcher payee = HDFC_PAYEE.matcher(text);
            description = payee.find() ? vpaDescription(payee.group(1)) : fallbackDescription(text);
            date = date(HDFC_DATE, text);
        }
        if (description.isBlank()) {
            description = fallbackDescription(text);
        }

        BigDecimal amount = amount(text);
        if (CREDITED.matcher(text).find() && !DEBITED.matcher(text).find()) {
            amount = amount.negate();
        }

        return new Transaction(String.format("SMS_%08x", text.hashCode()), date, description, amount);
    }

    static SmsBank detect(String sms) {
        String lower = sms.toLowerCase(Locale.ROOT);
        if (lower.contains("hdfc")) return SmsBank.HDFC;
        if (lower.startsWith("sbi") || lower.contains("sbi:") || lower.contains("state bank")) return SmsBank.SBI;
        return SmsBank.GENERIC;
    }

    static String vpaDescription(String payee) {
        return payee.replace("@", " ")
                .replace("ICICI", "")
                .replace("AXISBANK", "")
                .trim();
    }

    private static String fallbackDescription(String sms) {
        return sms.length() <= FALLBACK_DESCRIPTION_LENGTH ? sms : sms.substring(0, FALLBACK_DESCRIPTION_LENGTH);
    }

    private static BigDecimal amount(String sms) {
        Matcher m = AMOUNT.matcher(sms);
        if (!m.find()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(m.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private LocalDate date(Pattern pattern, String sms) {
        Matcher m = pattern.matcher(sms);
        if (m.find()) {
            var parsed = StatementDates.parse(m.group(1));
            if (parsed.isPresent()) return parsed.get();
        }
        return LocalDate.now(clock);
    }
}
