package com.spendlens.backend.classification.entity;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleSource {
    SEED,
    LEARNED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
