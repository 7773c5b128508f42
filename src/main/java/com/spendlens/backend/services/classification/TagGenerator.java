package com.spendlens.backend.services.classification;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.spendlens.backend.classification.model.P2pDirection;
import com.spendlens.backend.classification.model.Transaction;

/**
 * Derives display tags from a finished classification. Output is sorted.
 */
final class TagGenerator {

    private TagGenerator() {}

    static final String P2P = "p2p";
    static final String P2P_SENT = "p2p-sent";
    static final String P2P_RECEIVED = "p2p-received";
    static final String SPLIT = "split-transaction";
    static final String CREDIT = "credit";
    static final String LARGE_EXPENSE = "large-expense";
    static final String RECURRING = "recurring";

    static Set<String> tags(Transaction tx, String category, String subcategory,
                            boolean p2p, P2pDirection direction, boolean split, BigDecimal largeExpenseAmount) {
        Set<String> tags = new TreeSet<>();
        if (p2p) {
            tags.add(P2P);
            if (direction == P2pDirection.SENT) tags.add(P2P_SENT);
            if (direction == P2pDirection.RECEIVED) tags.add(P2P_RECEIVED);
        }
        if (split) tags.add(SPLIT);
        if (tx.isCredit()) tags.add(CREDIT);
        if (largeExpenseAmount != null && tx.amount() != null && tx.amount().compareTo(largeExpenseAmount) > 0) {
            tags.add(LARGE_EXPENSE);
        }
        if (isRecurring(category, subcategory)) tags.add(RECURRING);
        return tags;
    }

    private static boolean isRecurring(String category, String subcategory) {
        if ("Subscriptions & Memberships".equals(category)) return true;
        if (subcategory == null) return false;
        String sub = subcategory.toLowerCase(Locale.ROOT);
        return sub.contains("subscription") || sub.contains("ott") || sub.contains("streaming");
    }
}
