package com.spendlens.backend.dto;

import java.math.BigDecimal;

import com.spendlens.backend.classification.model.LineItem;

public record LineItemDTO(String name, BigDecimal amount) {

    public LineItem toLineItem() {
        return new LineItem(name, amount);
    }
}
