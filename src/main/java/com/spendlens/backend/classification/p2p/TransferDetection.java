package com.spendlens.backend.classification.p2p;

import com.spendlens.backend.classification.model.P2pDirection;

/**
 * Outcome of {@link TransferDetector#detect(String, java.math.BigDecimal)}.
 *
 * When {@code p2p} is false every other field is null or zero, except {@code reason}.
 *
 * @param relationship   personal, obligation, income, gift or unknown
 * @param label          display subcategory, e.g. "UPI Sent - Friends & Family"
 */
public record TransferDetection(
        boolean p2p,
        P2pDirection direction,
        String counterparty,
        String counterpartyHandle,
        double confidence,
        String transferMode,
        String relationship,
        String label,
        String reason
) {
    public static TransferDetection none(String reason) {
        return new TransferDetection(false, null, null, null, 0.0, null, null, null, reason);
    }
}
