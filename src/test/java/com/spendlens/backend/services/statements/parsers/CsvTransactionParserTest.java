package com.spendlens.backend.services.statements.parsers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;

class CsvTransactionParserTest {

    private final CsvTransactionParser parser = new CsvTransactionParser(new ObjectMapper());

    @Test
    void debitCreditColumns_setSign_rowsWithoutAmountSkipped() {
        String csv = "Date,Narration,Debit,Credit,Transaction_ID\n"
                + "15/01/2024,UPI/ZOMATO,450.00,,T1\n"
                + "2024-01-16,NEFT SALARY,,\"50,000.00\",T2\n"
                + "17/01/2024,NO AMOUNT,,,T3\n";

        CsvParseResult result = parser.parse(csv);

        assertEquals(2, result.transactions().size());
        assertEquals(1, result.skippedRows());

        Transaction zomato = result.transactions().get(0);
        assertEquals("T1", zomato.id());
        assertEquals(LocalDate.of(2024, 1, 15), zomato.date());
        assertEquals(0, new BigDecimal("450.00").compareTo(zomato.amount()));

        Transaction salary = result.transactions().get(1);
        assertEquals(0, new BigDecimal("-50000.00").compareTo(salary.amount()));
    }

    @Test
    void amountColumnWithLineItems_andGeneratedIds() {
        String csv = "description,amount,line_items\n"
                + "AMAZON ORDER,\"Rs. 1,200\",\"[{\"\"name\"\":\"\"laptop sleeve\"\",\"\"amount\"\":700},{\"\"name\"\":\"\"mouse\"\",\"\"amount\"\":500}]\"\n"
                + "REFUND,(300),\n";

        CsvParseResult result = parser.parse(csv);

        Transaction order = result.transactions().get(0);
        assertEquals("ROW_1", order.id());
        assertEquals(2, order.lineItems().size());
        assertEquals("mouse", order.lineItems().get(1).name());
        assertEquals(0, new BigDecimal("1200").compareTo(order.amount()));

        Transaction refund = result.transactions().get(1);
        assertEquals("ROW_2", refund.id());
        assertEquals(0, new BigDecimal("-300").compareTo(refund.amount()));
        assertTrue(refund.lineItems().isEmpty());
    }

    @Test
    void unreadableLineItems_ignored() {
        CsvParseResult result = parser.parse("description,amount,line_items\nX,10,not-json\n");

        assertTrue(result.transactions().get(0).lineItems().isEmpty());
    }

    @Test
    void emptyOrMalformedCsv_rejected() {
        assertThrows(InvalidInputException.class, () -> parser.parse(" "));
        assertThrows(InvalidInputException.class, () -> parser.parse("description,amount\n\"unterminated,10\n"));
    }
}
