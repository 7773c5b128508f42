package com.spendlens.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record SmsClassifyRequestDTO(
        @NotBlank(message = "sms is required")
        String sms,
        // HDFC, SBI ou vazio para detecção automática
        String bank,
        @Valid
        ClassificationOptionsDTO options
) {}
