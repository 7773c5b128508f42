package com.spendlens.backend.services.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.spendlens.backend.classification.custom.CustomCategoryCommand;
import com.spendlens.backend.classification.entity.CustomRuleType;
import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.model.ClassificationOptions;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.LineItem;
import com.spendlens.backend.classification.model.P2pDirection;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.config.ClassificationProperties.LlmReviewPolicy;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.ProviderException;
import com.spendlens.backend.support.EngineFixture;
import com.spendlens.backend.support.FakeInferenceProvider;

class TransactionClassificationServiceTest {

    private static final ClassificationOptions LLM_ON = new ClassificationOptions(true, 0.70, false);
    private static final ClassificationOptions LLM_OFF = new ClassificationOptions(false, 0.70, false);

    private static Transaction tx(String id, String description, String amount) {
        return new Transaction(id, LocalDate.of(2024, 1, 15), description, new BigDecimal(amount));
    }

    @Test
    void seededMerchant_isDecidedByRule_withoutInference() {
        FakeInferenceProvider provider = FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.99);
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T1", "ZOMATO ORDER #789456", "450"), LLM_ON);

        assertEquals("Food & Dining", r.getCategory());
        assertEquals("Food Delivery", r.getSubcategory());
        assertEquals(CategorizationMethod.RULE, r.getMethod());
        assertFalse(r.isNeedsReview());
        assertEquals("Zomato", r.getMerchantName());
        assertEquals(0, provider.calls());
    }

    @Test
    void llmDisabled_unknownDescription_isUncategorizedAndFlagged_withoutInference() {
        FakeInferenceProvider provider = FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.99);
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T2", "QWXZ VKRT 7781", "120"), LLM_OFF);

        assertEquals(Taxonomy.UNCATEGORIZED, r.getCategory());
        assertNull(r.getSubcategory());
        assertEquals(0.0, r.getConfidence());
        assertTrue(r.isNeedsReview());
        assertEquals(0, provider.calls());
    }

    @Test
    void llmEnabled_unknownDescription_usesInference() {
        FakeInferenceProvider provider = FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.9);
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T3", "QWXZ VKRT 7781", "120"), LLM_ON);

        assertEquals("Shopping", r.getCategory());
        assertEquals("Electronics", r.getSubcategory());
        assertEquals(CategorizationMethod.LLM, r.getMethod());
        assertEquals(0.9, r.getConfidence(), 1e-9);
        assertFalse(r.isNeedsReview());
        assertEquals(1, provider.calls());
    }

    @Test
    void llmResult_alwaysReviewedUnderAlwaysPolicy() {
        FakeInferenceProvider provider = FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.95);
        EngineFixture engine = new EngineFixture(provider);
        engine.classificationProperties.setLlmReviewPolicy(LlmReviewPolicy.ALWAYS);

        ClassificationResult r = engine.service.classify(tx("T4", "QWXZ VKRT 7781", "120"), LLM_ON);

        assertEquals(CategorizationMethod.LLM, r.getMethod());
        assertTrue(r.isNeedsReview());
    }

    @Test
    void llmAnswerWithoutConfidence_getsAssumedConfidence() {
        FakeInferenceProvider provider = FakeInferenceProvider.answering(
                req -> "[{\"index\":0,\"category\":\"shopping\",\"subcategory\":\"electronics\"}]");
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T5", "QWXZ VKRT 7781", "120"), LLM_ON);

        assertEquals("Shopping", r.getCategory());
        assertEquals("Electronics", r.getSubcategory());
        assertEquals(0.70, r.getConfidence(), 1e-9);
        assertFalse(r.isNeedsReview());
    }

    @Test
    void providerFailure_fallsBackToUncategorized() {
        FakeInferenceProvider provider = FakeInferenceProvider.answering(req -> {
            throw new ProviderException("fake", "Rate limited (HTTP 429)");
        });
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T6", "QWXZ VKRT 7781", "120"), LLM_ON);

        assertEquals(Taxonomy.UNCATEGORIZED, r.getCategory());
        assertTrue(r.isNeedsReview());
        // uma tentativa normal e uma estrita
        assertEquals(2, provider.calls());
    }

    @Test
    void useLlmOnly_skipsRuleStage() {
        FakeInferenceProvider provider = FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.8);
        EngineFixture engine = new EngineFixture(provider);

        ClassificationResult r = engine.service.classify(tx("T7", "ZOMATO ORDER", "450"),
                new ClassificationOptions(true, 0.70, true));

        assertEquals(CategorizationMethod.LLM, r.getMethod());
        assertEquals("Shopping", r.getCategory());
        assertEquals(1, provider.calls());
    }

    @Test
    void statisticalStage_decidesWhenNoRuleMatches() {
        EngineFixture engine = new EngineFixture();

        ClassificationResult r = engine.service.classify(tx("T8", "PETROL PUMP FUEL REFILL", "1500"), LLM_OFF);

        assertEquals("Transportation", r.getCategory());
        assertEquals("Petrol & Fuel", r.getSubcategory());
        assertEquals(CategorizationMethod.ML, r.getMethod());
        assertFalse(r.isNeedsReview());
    }

    @Test
    void belowThresholdRule_isReportedInDefaultDecision() {
        EngineFixture engine = new EngineFixture();
        engine.registry.upsertLearned("qwxz mart", "Shopping", "Electronics", "Qwxz", 0.5);

        ClassificationResult r = engine.service.classify(tx("T9", "QWXZ MART", "300"), LLM_OFF);

        assertEquals(Taxonomy.UNCATEGORIZED, r.getCategory());
        assertEquals(CategorizationMethod.RULE, r.getMethod());
        assertEquals(0.0, r.getConfidence());
        assertTrue(r.isNeedsReview());
        assertTrue(r.getReason().contains("rule candidate Shopping"));
    }

    @Test
    void registryDown_classificationContinuesWithStatisticalStage() {
        EngineFixture engine = new EngineFixture();
        engine.store.setDown(true);
        engine.registry.invalidate();

        ClassificationResult r = engine.service.classify(tx("T10", "NETFLIX SUBSCRIPTION MONTHLY", "649"), LLM_OFF);

        assertEquals("Entertainment", r.getCategory());
        assertEquals(CategorizationMethod.ML, r.getMethod());
    }

    @Test
    void sameInput_sameResult() {
        EngineFixture engine = new EngineFixture(FakeInferenceProvider.categorizingAll("Shopping", "Electronics", 0.9));
        Transaction t = tx("T11", "UPI/P2P/123456789/RAHUL SHARMA/rahul@okaxis", "500");

        ClassificationResult first = engine.service.classify(t, LLM_ON);
        ClassificationResult second = engine.service.classify(t, LLM_ON);

        assertEquals(first, second);
    }

    @Test
    void personalTransfer_isTaggedP2p_withoutChangingCategoryPath() {
        EngineFixture engine = new EngineFixture();

        ClassificationResult r = engine.service.classify(tx("T12", "UPI/P2P/123456789/RAHUL SHARMA/rahul@okaxis", "500"), LLM_OFF);

        assertTrue(r.isP2p());
        assertEquals(P2pDirection.SENT, r.getP2pDirection());
        assertEquals("Rahul Sharma", r.getP2pCounterparty());
        assertEquals("upi", r.getP2pTransferMode());
        assertTrue(r.getTags().contains("p2p"));
        assertTrue(r.getTags().contains("p2p-sent"));
    }

    @Test
    void merchantVpaSms_isNotP2p() {
        EngineFixture engine = new EngineFixture();

        ClassificationResult r = engine.service.classify(
                tx("T13", "HDFC Bank: Rs.450.00 debited from A/c XX1234 on 15-Jan-24 to VPA ZOMATO@ICICI Ref No 456789", "450"),
                LLM_OFF);

        assertFalse(r.isP2p());
        assertNull(r.getP2pDirection());
        assertEquals("Food & Dining", r.getCategory());
    }

    @Test
    void lineItems_areClassifiedOneByOne_andLargestItemWins() {
        EngineFixture engine = new EngineFixture();
        Transaction parent = new Transaction("T14", LocalDate.of(2024, 2, 1), "AMAZON ORDER", new BigDecimal("949"),
                List.of(new LineItem("Zomato order", new BigDecimal("300")),
                        new LineItem("Netflix", new BigDecimal("649"))));

        ClassificationResult r = engine.service.classify(parent, LLM_OFF);

        assertTrue(r.isSplit());
        assertEquals(2, r.getSplitItems().size());
        assertEquals("Food & Dining", r.getSplitItems().get(0).category());
        assertEquals("Entertainment", r.getCategory());
        assertEquals("OTT Subscriptions", r.getSubcategory());
        assertTrue(r.getTags().contains("split-transaction"));
        assertTrue(r.getTags().contains("recurring"));
    }

    @Test
    void lineItemsAboveTotal_areRejected() {
        EngineFixture engine = new EngineFixture();
        Transaction parent = new Transaction("T15", null, "ORDER", new BigDecimal("100"),
                List.of(new LineItem("Netflix", new BigDecimal("649"))));

        assertThrows(InvalidInputException.class, () -> engine.service.classify(parent, LLM_OFF));
    }

    @Test
    void missingAmount_isRejected_butBlankDescriptionIsNot() {
        EngineFixture engine = new EngineFixture();

        assertThrows(InvalidInputException.class,
                () -> engine.service.classify(new Transaction("T16", null, "X", null), LLM_OFF));

        ClassificationResult r = engine.service.classify(new Transaction("T17", null, "  ", new BigDecimal("10")), LLM_OFF);
        assertEquals(Taxonomy.UNCATEGORIZED, r.getCategory());
        assertTrue(r.isNeedsReview());
    }

    @Test
    void creditAndLargeExpense_tags() {
        EngineFixture engine = new EngineFixture();

        ClassificationResult credit = engine.service.classify(tx("T18", "NETFLIX REFUND", "-649"), LLM_OFF);
        ClassificationResult large = engine.service.classify(tx("T19", "NETFLIX", "25000"), LLM_OFF);

        assertTrue(credit.getTags().contains("credit"));
        assertTrue(large.getTags().contains("large-expense"));
    }

    @Test
    void customCategory_addsTagsButKeepsTheEngineCategory() {
        EngineFixture engine = new EngineFixture();
        engine.customCategories.create(new CustomCategoryCommand("Eating Out", null, List.of("eating-out"),
                List.of(new CustomCategoryCommand.Rule(CustomRuleType.ORIGINAL_CATEGORY, "Food & Dining", null, null, null, false))));

        ClassificationResult r = engine.service.classify(tx("T20", "ZOMATO ORDER #789456", "450"), LLM_OFF);
        ClassificationResult other = engine.service.classify(tx("T21", "NETFLIX", "649"), LLM_OFF);

        assertEquals("Food & Dining", r.getCategory());
        assertEquals("Eating Out", r.getCustomCategory());
        assertTrue(r.getTags().contains("eating-out"));
        assertNull(other.getCustomCategory());
        assertFalse(other.getTags().contains("eating-out"));
    }

    @Test
    void customCategoryStoreDown_classificationStillSucceeds() {
        EngineFixture engine = new EngineFixture();
        engine.customCategoryStore.setDown(true);

        ClassificationResult r = engine.service.classify(tx("T22", "ZOMATO ORDER #789456", "450"), LLM_OFF);

        assertEquals("Food & Dining", r.getCategory());
        assertNull(r.getCustomCategory());
    }
}
