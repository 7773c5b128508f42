package com.spendlens.backend.classification.custom;

import java.util.Set;

/**
 * Winning custom category for one transaction.
 *
 * @param score sum of (11 - priority) over the matched rules
 */
public record CustomCategoryMatch(String name, Set<String> tags, int score, int matchedRules) {
}
