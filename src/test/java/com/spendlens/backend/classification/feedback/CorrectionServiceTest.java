package com.spendlens.backend.classification.feedback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spendlens.backend.classification.entity.CategoryCorrection;
import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.support.EngineFixture;
import com.spendlens.backend.support.InMemoryCorrectionStore;

class CorrectionServiceTest {

    private EngineFixture engine;
    private InMemoryCorrectionStore corrections;
    private CorrectionService service;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        corrections = new InMemoryCorrectionStore();
        service = new CorrectionService(corrections, engine.registry, engine.classificationProperties);
    }

    private ClassificationResult classify(String description) {
        return engine.service.classify(new Transaction("T1", null, description, new BigDecimal("180")));
    }

    @Test
    void correction_makesNextClassificationARuleMatch() {
        CorrectionOutcome outcome = service.submit(new CorrectionCommand(
                "T1", "CHAI POINT KORAMANGALA", "Chai Point", "Uncategorized", "food & dining", "cafes & coffee"));

        assertEquals(CategorizationMethod.MANUAL, outcome.result().getMethod());
        assertEquals(1.0, outcome.result().getConfidence());
        assertEquals("chai point", outcome.rule().pattern());
        assertTrue(outcome.rule().isLearned());

        ClassificationResult next = classify("CHAI POINT INDIRANAGAR");
        assertEquals(CategorizationMethod.RULE, next.getMethod());
        assertEquals("Food & Dining", next.getCategory());
        assertEquals("Cafes & Coffee", next.getSubcategory());
        assertFalse(next.isNeedsReview());
    }

    @Test
    void learnedRuleConfidence_neverBelowThreshold() {
        engine.classificationProperties.setLowConfidenceThreshold(0.99);

        CorrectionOutcome outcome = service.submit(new CorrectionCommand(
                null, "QWXZ STORE 42", null, null, "Shopping", null));

        assertEquals(0.99, outcome.rule().confidence(), 1e-9);
    }

    @Test
    void patternKey_prefersMerchantContainedInDescription() {
        assertEquals("chai point", CorrectionService.patternKey("UPI/CHAI POINT/123456", "Chai-Point"));
        assertEquals("upi blue tokai", CorrectionService.patternKey("UPI/BLUE TOKAI/123456", "Third Wave"));
        assertEquals("third wave", CorrectionService.patternKey(null, "Third Wave"));
    }

    @Test
    void conflictingCorrections_lastWriteWins_historyKeepsBoth() {
        service.submit(new CorrectionCommand("T1", "QWXZ VKRT", null, null, "Shopping", "Electronics"));
        service.submit(new CorrectionCommand("T2", "QWXZ VKRT", null, "Shopping", "Education", "Online Courses"));

        ClassificationResult next = classify("QWXZ VKRT");
        assertEquals("Education", next.getCategory());

        List<CategoryCorrection> history = service.history("QWXZ VKRT", null);
        assertEquals(2, history.size());
        assertEquals("Education", history.get(0).getNewCategory());
        assertEquals("Shopping", history.get(1).getNewCategory());
        assertEquals("Education", corrections.latest("qwxz vkrt").orElseThrow().getNewCategory());
    }

    @Test
    void unknownCategory_isKeptAsGiven() {
        CategoryCorrection saved = service.recordCorrection(new CorrectionCommand(
                null, "QWXZ VKRT", null, null, "  Pets ", "Vet"));

        assertEquals("Pets", saved.getNewCategory());
        assertEquals("Vet", saved.getNewSubcategory());
        assertEquals(1, corrections.size());
    }

    @Test
    void invalidCorrections_rejected() {
        assertThrows(InvalidInputException.class, () -> service.recordCorrection(null));
        assertThrows(InvalidInputException.class, () -> service.recordCorrection(
                new CorrectionCommand(null, "QWXZ", null, null, " ", null)));
        assertThrows(InvalidInputException.class, () -> service.recordCorrection(
                new CorrectionCommand(null, "### ///", null, null, "Shopping", null)));
        assertEquals(0, corrections.size());
    }

    @Test
    void history_blankKeyIsEmpty() {
        assertTrue(service.history(" ", null).isEmpty());
    }
}
