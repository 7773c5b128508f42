package com.spendlens.backend.services.statements.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

class PhonePeStatementParserTest {

    static final List<String> STATEMENT = List.of(
            "Transaction Statement for 9876543210",
            "Date Transaction Details Type Amount",
            "Feb 27, 2026 Paid to Chai Point DEBIT ₹150",
            "10:15 am Transaction ID T2602271015123",
            "UTR No 123456789012",
            "Paid by XXXXXX1234",
            "Feb 28, 2026 Received from Rahul Sharma CREDIT ₹2,000",
            "09:00 pm Transaction ID T26022809001",
            "Credited to XXXXXX1234",
            "Mar 1, 2026 Paid to Bharat Sanchar Nigam Limited Telecom DEBIT ₹499",
            "Services Kerala Circle",
            "Page 1 of 1",
            "This is a system generated statement");

    private final PhonePeStatementParser parser = new PhonePeStatementParser();

    @Test
    void isApplicable_onPhonePeHeader() {
        assertTrue(parser.isApplicable(STATEMENT));
    }

    @Test
    void isApplicable_needsTransactionIdsAndRupeeRowsWithoutHeader() {
        assertTrue(parser.isApplicable(List.of(
                "Feb 27, 2026 Paid to Chai Point DEBIT ₹150",
                "10:15 am Transaction ID T2602271015123")));
        assertFalse(parser.isApplicable(List.of(
                "01/01/2024 UPI/ZOMATO 450.00 12,345.67",
                "02/01/2024 NEFT SALARY 50,000.00 Cr 62,345.67")));
    }

    @Test
    void parse_rowsWithSignsAndWrappedDescriptions() {
        List<StatementRow> rows = parser.parse(STATEMENT);

        assertEquals(3, rows.size());

        assertEquals(LocalDate.of(2026, 2, 27), rows.get(0).date());
        assertEquals("Paid to Chai Point", rows.get(0).description());
        assertEquals(0, new BigDecimal("150").compareTo(rows.get(0).amount()));

        assertEquals(0, new BigDecimal("-2000").compareTo(rows.get(1).amount()));
        assertEquals("Received from Rahul Sharma", rows.get(1).description());

        assertEquals(LocalDate.of(2026, 3, 1), rows.get(2).date());
        assertEquals("Paid to Bharat Sanchar Nigam Limited Telecom Services Kerala Circle", rows.get(2).description());
    }
}
