package com.spendlens.backend.classification.ml;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.spendlens.backend.classification.rules.DescriptionNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Multinomial naive Bayes over unigram and bigram features of the normalized description.
 *
 * Labels are {@code "Category > Subcategory"}. Features missing from the training vocabulary
 * are ignored; a description with no known feature gets {@link Prediction#none()}. The model is
 * built once in the constructor and never changes afterwards.
 */
@Slf4j
public class NaiveBayesTransactionClassifier implements StatisticalClassifier {

    static final String CREDIT_FEATURE = "__credit";
    private static final String LABEL_SEPARATOR = " > ";
    private static final double ALPHA = 0.1;

    private static final Set<String> NOISE = Set.of(
            "payment", "purchase", "txn", "transaction", "ref", "upi", "pg", "gateway");

    private final Map<String, LabelStats> labels;
    private final Set<String> vocabulary;
    private final int documentCount;

    public NaiveBayesTransactionClassifier(List<TrainingExample> examples) {
        if (examples == null || examples.isEmpty()) {
            throw new IllegalArgumentException("training examples are required");
        }

        Map<String, LabelStats> byLabel = new LinkedHashMap<>();
        Set<String> vocab = new HashSet<>();
        int docs = 0;

        for (TrainingExample ex : examples) {
            List<String> features = features(ex.text(), ex.credit());
            if (features.isEmpty()) continue;
            String label = ex.category() + LABEL_SEPARATOR + (ex.subcategory() == null ? "" : ex.subcategory());
            LabelStats stats = byLabel.computeIfAbsent(label, k -> new LabelStats());
            stats.documents++;
            for (String f : features) {
                stats.featureCounts.merge(f, 1, Integer::sum);
                stats.totalFeatures++;
                vocab.add(f);
            }
            docs++;
        }

        this.labels = Collections.unmodifiableMap(byLabel);
        this.vocabulary = Collections.unmodifiableSet(vocab);
        this.documentCount = docs;
        log.info("[ML] Naive Bayes trained: {} examples, {} labels, {} features", docs, byLabel.size(), vocab.size());
    }

    @Override
    public Prediction predict(String description, BigDecimal amount) {
        boolean credit = amount != null && amount.signum() < 0;
        List<String> known = new ArrayList<>();
        for (String f : features(description, credit)) {
            if (vocabulary.contains(f)) known.add(f);
        }
        if (known.isEmpty()) {
            return Prediction.none();
        }

        int v = vocabulary.size();
        Map<String, Double> logScores = new HashMap<>();
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, LabelStats> e : labels.entrySet()) {
            LabelStats s = e.getValue();
            double score = Math.log((double) s.documents / documentCount);
            double denominator = s.totalFeatures + ALPHA * v;
            for (String f : known) {
                score += Math.log((s.featureCounts.getOrDefault(f, 0) + ALPHA) / denominator);
            }
            logScores.put(e.getKey(), score);
            max = Math.max(max, score);
        }

        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (Map.Entry<String, Double> e : logScores.entrySet()) {
            sum += Math.exp(e.getValue() - max);
            if (e.getValue() > bestScore) {
                bestScore = e.getValue();
                best = e.getKey();
            }
        }

        double confidence = Math.exp(bestScore - max) / sum;
        int sep = best.indexOf(LABEL_SEPARATOR);
        String category = best.substring(0, sep);
        String subcategory = best.substring(sep + LABEL_SEPARATOR.length());
        return new Prediction(category, subcategory.isEmpty() ? null : subcategory,
                Math.round(confidence * 1000.0) / 1000.0, known);
    }

    int vocabularySize() {
        return vocabulary.size();
    }

    static List<String> features(String text, boolean credit) {
        List<String> tokens = new ArrayList<>();
        for (String t : DescriptionNormalizer.tokens(text)) {
            if (!NOISE.contains(t)) tokens.add(t);
        }
        List<String> out = new ArrayList<>(tokens);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            out.add(tokens.get(i) + "_" + tokens.get(i + 1));
        }
        if (credit && !out.isEmpty()) {
            out.add(CREDIT_FEATURE);
        }
        return out;
    }

    private static final class LabelStats {
        int documents;
        int totalFeatures;
        final Map<String, Integer> featureCounts = new HashMap<>();
    }
}
