package com.spendlens.backend.services.chunking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.classification.rules.Taxonomy;
import com.spendlens.backend.exceptions.SchemaValidationException;
import com.spendlens.backend.services.ai.InferenceRequest;

/**
 * Prompts for text extraction and batch classification. The strict variants are used on the
 * single retry after a failed chunk.
 */
final class PromptTemplates {

    private PromptTemplates() {}

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String EXTRACTION_SYSTEM =
            "You are a financial document parser for Indian bank statements (SBI, HDFC, ICICI, Axis, Kotak, UCO, etc.).\n"
                    + "Extract every transaction from the text. Return ONLY a valid JSON array, no explanation, no markdown.\n"
                    + "Handle tables, multi-column layouts, and varying formats.";

    private static final String CLASSIFICATION_SYSTEM =
            "You are an Indian personal finance categorization engine. Return ONLY valid JSON, no explanation.";

    private static final String STRICT_SUFFIX =
            "\n\nSTRICT MODE: your previous answer could not be used. Output must start with '[' and end with ']'. "
                    + "No prose, no code fences, no trailing commas, no comments.";

    static InferenceRequest textExtraction(String chunkText, int chunkIndex, int totalChunks, int maxOutputTokens, boolean strict) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Extract ALL transactions from this bank statement text.\n\n");
        if (totalChunks > 1) {
            prompt.append("This is part ").append(chunkIndex + 1).append(" of ").append(totalChunks)
                    .append(" of a longer statement. Extract only rows fully present in this part.\n\n");
        }
        prompt.append("Return a JSON array. Each transaction must have:\n")
                .append("- date: string in YYYY-MM-DD format\n")
                .append("- amount: number (always positive)\n")
                .append("- type: \"debit\" or \"credit\"\n")
                .append("- narration: string (full description)\n")
                .append("- balance: number or null\n")
                .append("- reference: string or null (UTR/ref if present)\n\n")
                .append("Handle Indian number format (1,23,456.78 = 123456.78). Dr/Cr = debit/credit.\n\n")
                .append("Bank statement text:\n")
                .append(chunkText);
        if (strict) prompt.append(STRICT_SUFFIX);
        return new InferenceRequest(EXTRACTION_SYSTEM, prompt.toString(), maxOutputTokens);
    }

    static InferenceRequest batchClassification(List<Transaction> items, int maxOutputTokens, boolean strict) {
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Transaction tx = items.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", i);
            row.put("description", tx.description());
            row.put("amount", tx.amount());
            rows.add(row);
        }

        String itemsJson;
        try {
            itemsJson = MAPPER.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Failed to serialize batch items", e);
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("Categorize each Indian bank transaction below. Positive amounts are debits, negative amounts are credits.\n\n")
                .append("Allowed categories and subcategories:\n")
                .append(Taxonomy.promptSummary())
                .append("\n\nReturn a JSON array with one object per input item:\n")
                .append("- index: the item's index (0-based, as given)\n")
                .append("- category: one of the categories above\n")
                .append("- subcategory: one of that category's subcategories\n")
                .append("- merchant_name: cleaned merchant name or null\n")
                .append("- confidence: number between 0.0 and 1.0\n\n")
                .append("Items:\n")
                .append(itemsJson);
        if (strict) prompt.append(STRICT_SUFFIX);
        return new InferenceRequest(CLASSIFICATION_SYSTEM, prompt.toString(), maxOutputTokens);
    }
}
