package com.spendlens.backend.classification.feedback;

import java.util.List;
import java.util.Optional;

import com.spendlens.backend.classification.entity.CategoryCorrection;

/**
 * Append-only log of corrections, read by pattern key.
 */
public interface CorrectionStore {

    CategoryCorrection append(CategoryCorrection correction);

    /**
     * Newest first.
     */
    List<CategoryCorrection> history(String patternKey);

    Optional<CategoryCorrection> latest(String patternKey);
}
