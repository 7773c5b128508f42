package com.spendlens.backend.services.statements;

public enum ExtractionPath {
    /** Regex parsing found enough rows. */
    STRUCTURAL,
    /** Inference fallback, whole text in one call. */
    INFERENCE_SINGLE,
    /** Inference fallback over several chunks. */
    INFERENCE_CHUNKED,
    /** Fallback was tried but returned nothing; the structural rows are kept. */
    STRUCTURAL_AFTER_FAILED_FALLBACK
}
