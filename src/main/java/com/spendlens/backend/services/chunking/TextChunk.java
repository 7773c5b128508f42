package com.spendlens.backend.services.chunking;

/**
 * @param index       position of the chunk in the source text, starting at 0
 * @param recordCount record blocks in the chunk, overlap included
 */
public record TextChunk(int index, String text, int recordCount) {
}
