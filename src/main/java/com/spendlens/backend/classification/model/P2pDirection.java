package com.spendlens.backend.classification.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum P2pDirection {
    SENT,
    RECEIVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
