package com.spendlens.backend.classification.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

class NaiveBayesTransactionClassifierTest {

    private static final List<TrainingExample> CORPUS = List.of(
            new TrainingExample("starbucks coffee latte", "Food & Dining", "Cafes & Coffee"),
            new TrainingExample("coffee beans cafe", "Food & Dining", "Cafes & Coffee"),
            new TrainingExample("uber cab ride", "Transportation", "Cab & Taxi"),
            new TrainingExample("ola cab airport ride", "Transportation", "Cab & Taxi"),
            new TrainingExample("interest credited savings", "Income", "Interest", true));

    private final NaiveBayesTransactionClassifier classifier = new NaiveBayesTransactionClassifier(CORPUS);

    @Test
    void trainingPhrase_isPredictedConfidently() {
        Prediction p = classifier.predict("UBER CAB RIDE", new BigDecimal("320"));

        assertEquals("Transportation", p.category());
        assertEquals("Cab & Taxi", p.subcategory());
        assertTrue(p.confidence() > 0.9, "confidence was " + p.confidence());
        assertTrue(p.evidence().contains("uber_cab"));
    }

    @Test
    void unknownWords_giveNoPrediction() {
        Prediction p = classifier.predict("QWXZ VKRT", BigDecimal.ONE);

        assertFalse(p.hasCategory());
        assertEquals(0.0, p.confidence());
    }

    @Test
    void noiseTokensAreIgnored() {
        assertEquals(List.of("coffee"), NaiveBayesTransactionClassifier.features("UPI payment coffee", false));
    }

    @Test
    void creditFeature_addedForNegativeAmounts() {
        List<String> features = NaiveBayesTransactionClassifier.features("interest", true);
        assertTrue(features.contains(NaiveBayesTransactionClassifier.CREDIT_FEATURE));

        Prediction p = classifier.predict("INTEREST", new BigDecimal("-12.50"));
        assertEquals("Income", p.category());
    }

    @Test
    void emptyCorpus_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new NaiveBayesTransactionClassifier(List.of()));
    }

    @Test
    void seedCorpus_trains() {
        NaiveBayesTransactionClassifier seeded = new NaiveBayesTransactionClassifier(TrainingCorpus.SEED);

        assertTrue(seeded.vocabularySize() > 50);
        assertEquals("Transportation", seeded.predict("PETROL PUMP FUEL REFILL", BigDecimal.TEN).category());
    }
}
