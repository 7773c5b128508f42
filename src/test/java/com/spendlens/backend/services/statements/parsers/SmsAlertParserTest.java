package com.spendlens.backend.services.statements.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;

class SmsAlertParserTest {

    private final SmsAlertParser parser =
            new SmsAlertParser(Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void hdfcDebitAlert() {
        Transaction tx = parser.parse(
                "HDFC Bank: Rs.450.00 debited from A/c XX1234 on 15-Jan-24 to VPA ZOMATO@ICICI Ref No 456789",
                SmsBank.HDFC);

        assertEquals("ZOMATO", tx.description());
        assertEquals(0, new BigDecimal("450.00").compareTo(tx.amount()));
        assertEquals(LocalDate.of(2024, 1, 15), tx.date());
        assertTrue(tx.id().startsWith("SMS_"));
    }

    @Test
    void sbiDebitAlert() {
        Transaction tx = parser.parse(
                "SBI: Your A/c XX5678 is debited by Rs.1,200.00 on 16/01/24 to BIGBASKET ORDER. Avl Bal Rs.10,000",
                SmsBank.SBI);

        assertEquals("BIGBASKET ORDER", tx.description());
        assertEquals(0, new BigDecimal("1200.00").compareTo(tx.amount()));
        assertEquals(LocalDate.of(2024, 1, 16), tx.date());
    }

    @Test
    void genericCreditAlert_isNegativeAndDatedToday() {
        Transaction tx = parser.parse("Your a/c is credited with Rs.5,000.00 by NEFT from ACME", SmsBank.GENERIC);

        assertEquals(0, new BigDecimal("-5000.00").compareTo(tx.amount()));
        assertEquals(LocalDate.of(2024, 3, 1), tx.date());
        assertEquals("Your a/c is credited with Rs.5,000.00 by NEFT from ACME", tx.description());
    }

    @Test
    void sameSms_sameId() {
        String sms = "HDFC Bank: Rs.99.00 debited from A/c XX1234 on 15-Jan-24 to VPA NETFLIX@AXISBANK";
        assertEquals(parser.parse(sms, null).id(), parser.parse(sms, SmsBank.HDFC).id());
        assertEquals("NETFLIX", parser.parse(sms, null).description());
    }

    @Test
    void detect_bankFromText() {
        assertEquals(SmsBank.HDFC, SmsAlertParser.detect("HDFC Bank: Rs.1 debited"));
        assertEquals(SmsBank.SBI, SmsAlertParser.detect("Dear SBI: user"));
        assertEquals(SmsBank.GENERIC, SmsAlertParser.detect("Rs.1 debited"));
        assertEquals(SmsBank.GENERIC, SmsBank.from("unknown-bank"));
    }

    @Test
    void blankSms_rejected() {
        assertThrows(InvalidInputException.class, () -> parser.parse("  ", SmsBank.HDFC));
    }
}
