package com.spendlens.backend.services.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.custom.CustomCategoryMatch;
import com.spendlens.backend.classification.custom.CustomCategoryMatcher;
import com.spendlens.backend.classification.model.CategorizationMethod;
import com.spendlens.backend.classification.model.ClassificationOptions;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.LineItem;
import com.spendlens.backend.classification.model.SplitItem;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.ml.Prediction;
import com.spendlens.backend.classification.p2p.TransferDetection;
import com.spendlens.backend.classification.p2p.TransferDetector;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.classification.stages.ClassificationStage;
import com.spendlens.backend.classification.stages.InferenceStage;
import com.spendlens.backend.classification.stages.ReviewPolicy;
import com.spendlens.backend.classification.stages.RuleStage;
import com.spendlens.backend.classification.stages.StageContext;
import com.spendlens.backend.classification.stages.StageDecision;
import com.spendlens.backend.classification.stages.StatisticalStage;
import com.spendlens.backend.config.ClassificationProperties;
import com.spendlens.backend.services.chunking.InferredClassification;

import lombok.extern.slf4j.Slf4j;

/**
 * Classification decision engine.
 *
 * Stages run in a fixed order (registry rule, statistical model, inference fallback) and the
 * first confident decision wins. When none decides, the result is Uncategorized and flagged for
 * review. Transfer detection runs on every transaction and only fills the P2P fields. Line items
 * are classified one by one and the largest item decides the parent's category. A matching
 * custom category adds its tags and name but never changes the category.
 */
@Slf4j
@Service
public class TransactionClassificationService {

    private final List<ClassificationStage> stages;
    private final InferenceStage inferenceStage;
    private final TransferDetector transferDetector;
    private final CustomCategoryMatcher customCategoryMatcher;
    private final ClassificationProperties properties;

    public TransactionClassificationService(RuleStage ruleStage,
                                            StatisticalStage statisticalStage,
                                            InferenceStage inferenceStage,
                                            TransferDetector transferDetector,
                                            CustomCategoryMatcher customCategoryMatcher,
                                            ClassificationProperties properties) {
        this.stages = List.of(ruleStage, statisticalStage, inferenceStage);
        this.inferenceStage = inferenceStage;
        this.transferDetector = transferDetector;
        this.customCategoryMatcher = customCategoryMatcher;
        this.properties = properties;
    }

    public ClassificationResult classify(Transaction transaction) {
        return classify(transaction, ClassificationOptions.from(properties));
    }

    public ClassificationResult classify(Transaction transaction, ClassificationOptions options) {
        TransactionValidator.validate(transaction);
        ClassificationOptions opts = options != null ? options : ClassificationOptions.from(properties);

        if (transaction.hasLineItems()) {
            return classifySplit(transaction, opts);
        }

        StageDecision decision = decide(transaction, opts);
        ClassificationResult result = assemble(transaction, decision, opts, List.of());
        log.debug("[Classify] {} -> {} / {} (method={} confidence={} review={})",
                transaction.id(), result.getCategory(), result.getSubcategory(),
                result.getMethod(), result.getConfidence(), result.isNeedsReview());
        return result;
    }

    /**
     * Rebuilds a result around a category suggested by batch inference. P2P fields and tags are
     * recomputed from the transaction, so the outcome matches what a single-item call would give.
     */
    public ClassificationResult applyInference(Transaction transaction, InferredClassification inferred,
                                               ClassificationOptions options, String merchantHint) {
        StageDecision decision = inferenceStage.toDecision(inferred, merchantHint);
        return assemble(transaction, decision, options, List.of());
    }

    private StageDecision decide(Transaction transaction, ClassificationOptions options) {
        StageContext context = new StageContext(transaction, options);
        for (ClassificationStage stage : stages) {
            Optional<StageDecision> decision = stage.evaluate(context);
            if (decision.isPresent()) return decision.get();
        }
        return defaultDecision(context);
    }

    private static StageDecision defaultDecision(StageContext context) {
        boolean partialRule = context.getPartialRule() != null;
        CategorizationMethod method = partialRule ? CategorizationMethod.RULE : CategorizationMethod.ML;

        StringBuilder reason = new StringBuilder("No confident match");
        if (partialRule) {
            reason.append("; rule candidate ")
                    .append(context.getPartialRule().rule().category())
                    .append(" (").append(context.getPartialRule().confidence()).append(")");
        }
        Prediction ml = context.getStatisticalCandidate();
        if (ml != null && ml.hasCategory()) {
            reason.append("; ml candidate ").append(ml.category()).append(" (").append(ml.confidence()).append(")");
        }
        if (context.isRegistryDegraded()) {
            reason.append("; registry unavailable");
        }

        return new StageDecision(Taxonomy.UNCATEGORIZED, null, context.merchantHint(), method, 0.0, reason.toString());
    }

    private ClassificationResult classifySplit(Transaction parent, ClassificationOptions options) {
        List<SplitItem> items = new ArrayList<>();
        int dominant = -1;

        List<LineItem> lineItems = parent.lineItems();
        for (int i = 0; i < lineItems.size(); i++) {
            LineItem item = lineItems.get(i);
            Transaction child = new Transaction(parent.id() + "#" + (i + 1), parent.date(), item.name(), item.amount());
            StageDecision d = decide(child, options);
            boolean review = ReviewPolicy.needsReview(d.confidence(), d.method(),
                    options.lowConfidenceThreshold(), properties.getLlmReviewPolicy());
            items.add(new SplitItem(item.name(), item.amount(), d.category(), d.subcategory(), d.method(), d.confidence(), review));

            if (dominant < 0 || item.amount().abs().compareTo(lineItems.get(dominant).amount().abs()) > 0) {
                dominant = i;
            }
        }

        SplitItem top = items.get(dominant);
        // merchant do pai vem do próprio registro, sem chamada de inferência
        StageDecision own = decide(parent, options.withLlmFallback(false));
        StageDecision decision = new StageDecision(top.category(), top.subcategory(), own.merchantName(),
                top.method(), top.confidence(), "Split: largest item '" + top.name() + "'");
        return assemble(parent, decision, options, items);
    }

    private ClassificationResult assemble(Transaction tx, StageDecision decision, ClassificationOptions options,
                                          List<SplitItem> splitItems) {
        TransferDetection p2p = transferDetector.detect(tx.description(), tx.amount());
        boolean split = !splitItems.isEmpty();
        boolean needsReview = ReviewPolicy.needsReview(decision.confidence(), decision.method(),
                options.lowConfidenceThreshold(), properties.getLlmReviewPolicy());

        Set<String> tags = new TreeSet<>(TagGenerator.tags(tx, decision.category(), decision.subcategory(),
                p2p.p2p(), p2p.direction(), split, properties.getLargeExpenseAmount()));
        Optional<CustomCategoryMatch> custom = customCategoryMatcher.match(tx, decision.merchantName(), decision.category());
        custom.ifPresent(m -> tags.addAll(m.tags()));

        return ClassificationResult.builder()
                .transactionId(tx.id())
                .category(decision.category())
                .subcategory(decision.subcategory())
                .merchantName(decision.merchantName())
                .method(decision.method())
                .confidence(decision.confidence())
                .needsReview(needsReview)
                .p2p(p2p.p2p())
                .p2pDirection(p2p.direction())
                .p2pCounterparty(p2p.counterparty())
                .p2pConfidence(p2p.confidence())
                .p2pTransferMode(p2p.transferMode())
                .tags(tags)
                .customCategory(custom.map(CustomCategoryMatch::name).orElse(null))
                .split(split)
                .splitItems(splitItems)
                .reason(decision.reason())
                .build();
    }
}
