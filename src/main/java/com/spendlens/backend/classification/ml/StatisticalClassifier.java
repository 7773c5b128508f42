package com.spendlens.backend.classification.ml;

import java.math.BigDecimal;

/**
 * Category guess from description text alone. Implementations are stateless at prediction time
 * and safe to call from any thread.
 */
public interface StatisticalClassifier {

    Prediction predict(String description, BigDecimal amount);
}
