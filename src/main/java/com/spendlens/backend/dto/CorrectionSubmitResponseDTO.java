package com.spendlens.backend.dto;

import com.spendlens.backend.classification.feedback.CorrectionOutcome;
import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.registry.RegistryRule;

public record CorrectionSubmitResponseDTO(
        CorrectionResponseDTO correction,
        RegistryRule rule,
        ClassificationResult result
) {
    public static CorrectionSubmitResponseDTO from(CorrectionOutcome outcome) {
        return new CorrectionSubmitResponseDTO(
                CorrectionResponseDTO.from(outcome.correction()), outcome.rule(), outcome.result());
    }
}
