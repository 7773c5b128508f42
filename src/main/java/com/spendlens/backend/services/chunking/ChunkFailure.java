package com.spendlens.backend.services.chunking;

/**
 * @param chunkIndex index of the failed chunk, -1 when the whole call could not start
 * @param itemCount  items (batch mode) or record blocks (text mode) lost with the chunk
 * @param attempts   provider calls made for the chunk
 */
public record ChunkFailure(int chunkIndex, int itemCount, String reason, int attempts) {
}
