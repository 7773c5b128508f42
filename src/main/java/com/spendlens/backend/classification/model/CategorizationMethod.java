package com.spendlens.backend.classification.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CategorizationMethod {
    RULE,
    ML,
    LLM,
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
