package com.spendlens.backend.services.classification;

/**
 * @param index position of the record in the request
 */
public record RejectedRecord(int index, String transactionId, String reason) {
}
