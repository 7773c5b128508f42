package com.spendlens.backend.classification.rules;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw bank narrations into comparable keys.
 *
 * {@link #normalize(String)} case-folds, strips accents, drops reference numbers, dates and
 * masked account numbers, and collapses whitespace. {@link #looseNormalize(String)} additionally
 * treats every non-alphanumeric character as a space, which is the form registry patterns are
 * stored and matched in.
 */
public final class DescriptionNormalizer {

    private DescriptionNormalizer() {}

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private static final Pattern REFERENCE = Pattern.compile(
            "\\b(?:ref|reference|utr|rrn|txn|txnid|trxn)\\b\\.?\\s*(?:no|num|number|id)?\\.?\\s*[:#-]?\\s*[a-z]*\\d[a-z0-9]*");

    private static final Pattern HASH_NUMBER = Pattern.compile("#\\s*[a-z]*\\d[a-z0-9]*");

    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b\\d{1,4}[/.-]\\d{1,2}[/.-]\\d{2,4}\\b");

    private static final Pattern TEXT_DATE = Pattern.compile(
            "\\b\\d{1,2}[- ](?:jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*[- ]\\d{2,4}\\b");

    private static final Pattern ACCOUNT_MASK = Pattern.compile("\\b(?:a/c|acct|ac)?\\s*(?:no\\.?)?\\s*[x*]{2,}\\d{2,6}\\b");

    private static final Pattern LONG_NUMBER = Pattern.compile("\\b\\d{5,}\\b");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    public static String normalize(String input) {
        if (input == null) return "";
        String s = Normalizer.normalize(input, Normalizer.Form.NFD);
        s = DIACRITICS.matcher(s).replaceAll("");
        s = s.toLowerCase(Locale.ROOT);

        s = REFERENCE.matcher(s).replaceAll(" ");
        s = HASH_NUMBER.matcher(s).replaceAll(" ");
        s = NUMERIC_DATE.matcher(s).replaceAll(" ");
        s = TEXT_DATE.matcher(s).replaceAll(" ");
        s = ACCOUNT_MASK.matcher(s).replaceAll(" ");
        s = LONG_NUMBER.matcher(s).replaceAll(" ");

        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    public static String looseNormalize(String input) {
        String s = normalize(input);
        if (s.isEmpty()) return s;
        s = NON_ALNUM.matcher(s).replaceAll(" ");
        s = LONG_NUMBER.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    public static List<String> tokens(String input) {
        String loose = looseNormalize(input);
        if (loose.isEmpty()) return List.of();
        return Arrays.asList(loose.split(" "));
    }

    /**
     * True when every token of {@code looseKey} appears contiguously, on token boundaries, in
     * {@code looseDescription}. Both arguments must already be loose-normalized.
     */
    public static boolean containsTokens(String looseDescription, String looseKey) {
        if (looseDescription == null || looseKey == null || looseKey.isEmpty()) return false;
        return (" " + looseDescription + " ").contains(" " + looseKey + " ");
    }
}
