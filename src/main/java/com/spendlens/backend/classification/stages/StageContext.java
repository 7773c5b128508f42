package com.spendlens.backend.classification.stages;

import com.spendlens.backend.classification.ml.Prediction;
import com.spendlens.backend.classification.model.ClassificationOptions;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.registry.RegistryMatch;

import lombok.Getter;
import lombok.Setter;

/**
 * Scratch state for one classification call. Created per call and dropped afterwards; stages
 * use it to pass candidates that did not clear the threshold on to later stages.
 */
@Getter
@Setter
public class StageContext {

    private final Transaction transaction;
    private final ClassificationOptions options;

    /** Registry hit below threshold. */
    private RegistryMatch partialRule;

    private Prediction statisticalCandidate;

    private boolean registryDegraded;

    public StageContext(Transaction transaction, ClassificationOptions options) {
        this.transaction = transaction;
        this.options = options;
    }

    public String merchantHint() {
        return partialRule == null ? null : partialRule.rule().merchantName();
    }
}
