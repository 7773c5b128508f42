package com.spendlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "spendlens.chunking")
public class ChunkingProperties {

    /** Transactions per batch-mode chunk. */
    private int chunkSizeItems = 15;

    /** Character budget per text-mode chunk. */
    private int chunkSizeChars = 35_000;

    /** Texts at or below this size go out as one call. */
    private int singleCallCharCeiling = 40_000;

    /** Trailing record blocks of chunk N repeated at the start of chunk N+1. */
    private int overlapRecords = 1;

    private int maxConcurrency = 4;

    private int chunkTimeoutSeconds = 60;

    private int globalDeadlineSeconds = 300;

    private int maxOutputTokensText = 8192;

    private int maxOutputTokensBatch = 2048;
}
