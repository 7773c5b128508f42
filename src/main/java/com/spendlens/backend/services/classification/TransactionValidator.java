package com.spendlens.backend.services.classification;

import java.math.BigDecimal;

import com.spendlens.backend.classification.model.LineItem;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;

/**
 * Required fields are the id and the amount. A missing or blank description is not an error:
 * such a record comes out as Uncategorized and flagged for review.
 */
final class TransactionValidator {

    private TransactionValidator() {}

    private static final BigDecimal LINE_ITEM_TOLERANCE = new BigDecimal("0.01");

    static void validate(Transaction tx) {
        if (tx == null) throw new InvalidInputException("transaction is required");
        if (tx.id() == null || tx.id().isBlank()) throw new InvalidInputException("id is required");
        if (tx.amount() == null) throw new InvalidInputException("amount is required for transaction " + tx.id());

        if (tx.hasLineItems()) {
            BigDecimal sum = BigDecimal.ZERO;
            for (LineItem item : tx.lineItems()) {
                if (item == null || item.amount() == null) {
                    throw new InvalidInputException("line item amount is required for transaction " + tx.id());
                }
                sum = sum.add(item.amount().abs());
            }
            if (sum.compareTo(tx.amount().abs().add(LINE_ITEM_TOLERANCE)) > 0) {
                throw new InvalidInputException("line items of transaction " + tx.id() + " exceed its amount");
            }
        }
    }
}
