package com.spendlens.backend.services.chunking;

import java.util.List;

/**
 * Per-call report of chunk failures. Returned instead of an exception so callers can fall back.
 */
public record ChunkErrorSummary(int totalChunks, int failedChunks, String provider, List<ChunkFailure> failures) {

    public ChunkErrorSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static ChunkErrorSummary none(int totalChunks, String provider) {
        return new ChunkErrorSummary(totalChunks, 0, provider, List.of());
    }

    public static ChunkErrorSummary noProvider() {
        return new ChunkErrorSummary(0, 0, null,
                List.of(new ChunkFailure(-1, 0, "No inference provider configured", 0)));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean allFailed() {
        return hasFailures() && failedChunks >= totalChunks;
    }
}
