package com.spendlens.backend.services.statements.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

class GenericLineStatementParserTest {

    private final GenericLineStatementParser parser = new GenericLineStatementParser();

    @Test
    void parse_readsAmountBeforeBalanceAndCrDrMarkers() {
        List<StatementRow> rows = parser.parse(List.of(
                "Date Narration Amount Balance",
                "01/01/2024 UPI/ZOMATO/123456789 450.00 12,345.67",
                "02/01/2024 NEFT SALARY ACME 50,000.00 Cr 62,345.67",
                "05-Jan-24 ATM WDL 2,000.00 Dr 60,345.67",
                "04/01/2024 OPENING BALANCE",
                "03/01/2024 AB 10.00 100.00"));

        assertEquals(3, rows.size());

        StatementRow zomato = rows.get(0);
        assertEquals(LocalDate.of(2024, 1, 1), zomato.date());
        assertEquals("UPI/ZOMATO/123456789", zomato.description());
        assertEquals(0, new BigDecimal("450.00").compareTo(zomato.amount()));

        StatementRow salary = rows.get(1);
        assertEquals("NEFT SALARY ACME", salary.description());
        assertEquals(0, new BigDecimal("-50000.00").compareTo(salary.amount()));

        StatementRow atm = rows.get(2);
        assertEquals(LocalDate.of(2024, 1, 5), atm.date());
        assertEquals(0, new BigDecimal("2000.00").compareTo(atm.amount()));
    }

    @Test
    void amount_creditWordOnLineFlipsSign() {
        assertEquals(0, new BigDecimal("-1500").compareTo(
                GenericLineStatementParser.amount("01/02/2024 REFUND CREDIT FLIPKART 1500 9000", " 1500 9000")));
    }

    @Test
    void amount_skipsZeroColumnBeforeBalance() {
        assertEquals(0, new BigDecimal("250").compareTo(
                GenericLineStatementParser.amount("x", " 250 0.00 1000")));
    }

    @Test
    void amount_noNumbers() {
        assertNull(GenericLineStatementParser.amount("x", " nothing here"));
    }

    @Test
    void numericTokens_acceptIndianGrouping() {
        List<BigDecimal> numbers = GenericLineStatementParser.numericTokens("bal 1,23,456.78 and 12");
        assertEquals(2, numbers.size());
        assertEquals(0, new BigDecimal("123456.78").compareTo(numbers.get(0)));
    }
}
