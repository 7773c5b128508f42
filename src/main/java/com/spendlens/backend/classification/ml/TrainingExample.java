package com.spendlens.backend.classification.ml;

/**
 * @param credit true for phrases that describe money coming in
 */
public record TrainingExample(String text, String category, String subcategory, boolean credit) {

    public TrainingExample(String text, String category, String subcategory) {
        this(text, category, subcategory, false);
    }
}
