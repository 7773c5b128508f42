package com.spendlens.backend.services.classification;

import com.spendlens.backend.classification.model.ClassificationOptions;

/**
 * @param chunkSize      items per inference chunk, 0 for the configured default
 * @param useLlmChunked  send records left Uncategorized to chunked batch inference
 * @param classification options for the per-record engine pass
 */
public record BatchOptions(int chunkSize, boolean useLlmChunked, ClassificationOptions classification) {
}
