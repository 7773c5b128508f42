package com.spendlens.backend.classification.model;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Final categorized record for one transaction.
 *
 * Every field is computed by the classification call that produced it. Nothing is carried
 * over from an earlier run.
 */
@Value
@Builder(toBuilder = true)
public class ClassificationResult {

    String transactionId;
    String category;
    String subcategory;
    String merchantName;
    CategorizationMethod method;
    double confidence;
    boolean needsReview;

    boolean p2p;
    P2pDirection p2pDirection;
    String p2pCounterparty;
    double p2pConfidence;
    String p2pTransferMode;

    @Singular
    Set<String> tags;

    /** Name of the user's custom category whose rules matched, if any. */
    String customCategory;

    boolean split;

    @Singular
    List<SplitItem> splitItems;

    /** Short trace of the stage that decided the category. */
    String reason;
}
