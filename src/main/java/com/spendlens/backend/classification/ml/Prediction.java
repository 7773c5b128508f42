package com.spendlens.backend.classification.ml;

import java.util.List;

/**
 * @param evidence vocabulary features that contributed to the prediction
 */
public record Prediction(String category, String subcategory, double confidence, List<String> evidence) {

    public Prediction {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public static Prediction none() {
        return new Prediction(null, null, 0.0, List.of());
    }

    public boolean hasCategory() {
        return category != null && confidence > 0.0;
    }
}
