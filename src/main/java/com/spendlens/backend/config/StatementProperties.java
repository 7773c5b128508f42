package com.spendlens.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "spendlens.statement")
public class StatementProperties {

    /**
     * Structural extraction is considered successful from this many rows on.
     */
    private int minRowCountForStructuralSuccess = 3;

    /**
     * Shorter texts never trigger the inference fallback.
     */
    private int minTextLengthForFallback = 500;
}
