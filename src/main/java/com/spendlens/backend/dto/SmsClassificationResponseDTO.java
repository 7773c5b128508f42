package com.spendlens.backend.dto;

import com.spendlens.backend.classification.model.ClassificationResult;
import com.spendlens.backend.classification.model.Transaction;

public record SmsClassificationResponseDTO(Transaction transaction, ClassificationResult classification) {
}
