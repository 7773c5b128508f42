package com.spendlens.backend.classification.model;

import java.math.BigDecimal;

public record LineItem(String name, BigDecimal amount) {
}
