package com.spendlens.backend.classification.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spendlens.backend.classification.rules.SeedMerchants.SeedMerchant;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.RegistryUnavailableException;
import com.spendlens.backend.support.InMemoryRegistryStore;

class MerchantRuleRegistryTest {

    private InMemoryRegistryStore store;
    private MerchantRuleRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
        registry = new MerchantRuleRegistry(store);
        registry.seed(List.of(
                new SeedMerchant("Amazon", "Shopping", "Online Shopping", 0.95, List.of("amazon")),
                new SeedMerchant("Amazon Prime", "Entertainment", "OTT Subscriptions", 0.95, List.of("amazon prime")),
                new SeedMerchant("Zomato", "Food & Dining", "Food Delivery", 0.95, List.of("zomato")),
                new SeedMerchant("Ola", "Transportation", "Cab & Taxi", 0.7, List.of("ola"))));
    }

    @Test
    void exactMatch_isFlaggedExact() {
        RegistryMatch match = registry.lookup("ZOMATO").orElseThrow();

        assertTrue(match.exact());
        assertEquals("Food & Dining", match.rule().category());
    }

    @Test
    void containedMatch_picksLongestPattern() {
        RegistryMatch match = registry.lookup("AMAZON PRIME VIDEO RENEWAL").orElseThrow();

        assertFalse(match.exact());
        assertEquals("amazon prime", match.rule().pattern());
        assertEquals("Entertainment", match.rule().category());
    }

    @Test
    void learnedRule_beatsLongerSeedRule() {
        registry.upsertLearned("amazon", "Shopping", "Electronics", "Amazon", 0.97);

        RegistryMatch match = registry.lookup("AMAZON PRIME VIDEO RENEWAL").orElseThrow();

        assertTrue(match.rule().isLearned());
        assertEquals("Electronics", match.rule().subcategory());
    }

    @Test
    void upsertLearned_lastWriteWins() {
        registry.upsertLearned("chai point", "Food & Dining", "Cafes & Coffee", null, 0.95);
        registry.upsertLearned("Chai-Point", "Food & Dining", "Restaurants", null, 0.95);

        RegistryMatch match = registry.lookup("CHAI POINT").orElseThrow();
        assertEquals("Restaurants", match.rule().subcategory());
        assertEquals(1, registry.listRules().stream().filter(r -> r.pattern().equals("chai point")).count());
    }

    @Test
    void upsertLearned_blankPatternRejected() {
        assertThrows(InvalidInputException.class,
                () -> registry.upsertLearned("  ##  ", "Shopping", null, null, 0.95));
    }

    @Test
    void seed_neverOverwritesLearnedRule() {
        registry.upsertLearned("zomato", "Food & Dining", "Restaurants", "Zomato", 0.95);

        int inserted = registry.seed(List.of(
                new SeedMerchant("Zomato", "Food & Dining", "Food Delivery", 0.95, List.of("zomato"))));

        assertEquals(0, inserted);
        assertEquals("Restaurants", registry.lookup("zomato").orElseThrow().rule().subcategory());
    }

    @Test
    void snapshot_isReusedUntilWrite() {
        registry.lookup("zomato");
        registry.lookup("amazon");
        int loads = store.loads();

        registry.upsertLearned("blue tokai", "Food & Dining", "Cafes & Coffee", null, 0.95);
        registry.lookup("blue tokai");

        assertEquals(loads + 1, store.loads());
    }

    @Test
    void noMatch_isEmpty() {
        assertTrue(registry.lookup("QWXZ VKRT").isEmpty());
        assertTrue(registry.lookup("").isEmpty());
    }

    @Test
    void containsKnownMerchant_ignoresShortAndAmbiguousAliases() {
        assertTrue(registry.containsKnownMerchant("Zomato Ltd"));
        assertFalse(registry.containsKnownMerchant("Ola Kumar"));
        assertFalse(registry.containsKnownMerchant("Rahul Sharma"));
    }

    @Test
    void storeDown_lookupThrows_knownMerchantCheckDoesNot() {
        registry.invalidate();
        store.setDown(true);

        assertThrows(RegistryUnavailableException.class, () -> registry.lookup("zomato"));
        assertFalse(registry.containsKnownMerchant("zomato"));
    }
}
