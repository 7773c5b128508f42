package com.spendlens.backend.services.chunking;

/**
 * Category suggested by an inference provider for one transaction.
 *
 * @param confidence provider-reported confidence, null when the provider gave none
 * @param fallback   true when no usable answer exists for the item (failed chunk or item missing
 *                   from the response); category fields are null then
 */
public record InferredClassification(
        String transactionId,
        String category,
        String subcategory,
        String merchantName,
        Double confidence,
        boolean fallback
) {
    public static InferredClassification fallback(String transactionId) {
        return new InferredClassification(transactionId, null, null, null, null, true);
    }
}
