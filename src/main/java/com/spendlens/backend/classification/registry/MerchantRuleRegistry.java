package com.spendlens.backend.classification.registry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.entity.MerchantRuleEntry;
import com.spendlens.backend.classification.entity.RuleSource;
import com.spendlens.backend.classification.rules.DescriptionNormalizer;
import com.spendlens.backend.classification.rules.SeedMerchants;
import com.spendlens.backend.classification.rules.SeedMerchants.SeedMerchant;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Static and learned lookup table from description patterns to categories.
 *
 * Reads are served from an in-memory snapshot of the store, loaded on first use and rebuilt
 * after every write made through this class. Lookup order:
 * <ol>
 *     <li>exact match of the loose-normalized description against a pattern</li>
 *     <li>longest learned pattern contained in the description</li>
 *     <li>longest seed pattern contained in the description</li>
 * </ol>
 * Ties on length go to the higher confidence.
 */
@Slf4j
@Service
public class MerchantRuleRegistry {

    /** Seed patterns shorter than this are too generic to mark a description as a merchant. */
    private static final int MIN_MERCHANT_TOKEN_LENGTH = 4;
    private static final double MIN_MERCHANT_TOKEN_CONFIDENCE = 0.90;

    private static final Comparator<RegistryRule> LONGEST_FIRST = Comparator
            .comparingInt((RegistryRule r) -> r.pattern().length()).reversed()
            .thenComparing(Comparator.comparingDouble(RegistryRule::confidence).reversed());

    private final RegistryStore store;

    private volatile Snapshot snapshot;

    public MerchantRuleRegistry(RegistryStore store) {
        this.store = store;
    }

    /**
     * @throws RegistryUnavailableException when the rules cannot be loaded
     */
    public Optional<RegistryMatch> lookup(String description) {
        String loose = DescriptionNormalizer.looseNormalize(description);
        if (loose.isEmpty()) return Optional.empty();

        Snapshot current = current();

        RegistryRule exact = current.byPattern().get(loose);
        if (exact != null) {
            return Optional.of(new RegistryMatch(exact, true));
        }

        Optional<RegistryRule> learned = firstContained(current.learned(), loose);
        if (learned.isPresent()) {
            return Optional.of(new RegistryMatch(learned.get(), false));
        }

        return firstContained(current.seeded(), loose).map(r -> new RegistryMatch(r, false));
    }

    /**
     * True when the description contains a well-known merchant alias. Never throws: an
     * unreachable store simply means no merchant is known.
     */
    public boolean containsKnownMerchant(String description) {
        String loose = DescriptionNormalizer.looseNormalize(description);
        if (loose.isEmpty()) return false;
        try {
            for (RegistryRule r : current().seeded()) {
                if (r.pattern().length() < MIN_MERCHANT_TOKEN_LENGTH) continue;
                if (r.confidence() < MIN_MERCHANT_TOKEN_CONFIDENCE) continue;
                if (DescriptionNormalizer.containsTokens(loose, r.pattern())) {
                    return true;
                }
            }
            return false;
        } catch (RegistryUnavailableException e) {
            log.warn("[Registry] Known-merchant check skipped, registry unavailable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Upserts a learned rule. Last write wins for the same pattern.
     */
    public RegistryRule upsertLearned(String patternKey, String category, String subcategory,
                                      String merchantName, double confidence) {
        String pattern = DescriptionNormalizer.looseNormalize(patternKey);
        if (pattern.isEmpty()) {
            throw new InvalidInputException("pattern is required");
        }

        MerchantRuleEntry saved = store.upsert(MerchantRuleEntry.builder()
                .pattern(pattern)
                .category(category)
                .subcategory(subcategory)
                .merchantName(merchantName)
                .confidence(confidence)
                .source(RuleSource.LEARNED)
                .build());

        invalidate();
        log.info("[Registry] Learned rule pattern='{}' -> {} / {} (confidence={})",
                pattern, category, subcategory, confidence);
        return RegistryRule.of(saved);
    }

    /**
     * Inserts every seed alias that has no rule yet. Existing rows, learned ones included, are
     * left untouched.
     *
     * @return number of rules inserted
     */
    public int seed(List<SeedMerchant> merchants) {
        int inserted = 0;
        for (SeedMerchant m : merchants) {
            for (String alias : m.aliases()) {
                String pattern = DescriptionNormalizer.looseNormalize(alias);
                if (pattern.isEmpty()) continue;
                boolean written = store.insertIfAbsent(MerchantRuleEntry.builder()
                        .pattern(pattern)
                        .category(m.category())
                        .subcategory(m.subcategory())
                        .merchantName(m.name())
                        .confidence(m.confidence())
                        .source(RuleSource.SEED)
                        .build());
                if (written) inserted++;
            }
        }
        invalidate();
        return inserted;
    }

    public int seedDefaults() {
        return seed(SeedMerchants.MERCHANTS);
    }

    public List<RegistryRule> listRules() {
        List<RegistryRule> all = new ArrayList<>(current().byPattern().values());
        all.sort(Comparator.comparing(RegistryRule::pattern));
        return all;
    }

    public void invalidate() {
        snapshot = null;
    }

    private Snapshot current() {
        Snapshot s = snapshot;
        if (s != null) return s;

        synchronized (this) {
            if (snapshot != null) return snapshot;
            snapshot = load();
            return snapshot;
        }
    }

    private Snapshot load() {
        List<MerchantRuleEntry> entries = store.findAll();

        Map<String, RegistryRule> byPattern = new HashMap<>();
        List<RegistryRule> learned = new ArrayList<>();
        List<RegistryRule> seeded = new ArrayList<>();

        for (MerchantRuleEntry e : entries) {
            if (e == null || e.getPattern() == null || e.getPattern().isBlank()) continue;
            RegistryRule rule = RegistryRule.of(e);
            byPattern.put(rule.pattern(), rule);
            if (rule.isLearned()) {
                learned.add(rule);
            } else {
                seeded.add(rule);
            }
        }

        learned.sort(LONGEST_FIRST);
        seeded.sort(LONGEST_FIRST);

        log.debug("[Registry] Snapshot loaded: {} learned, {} seed rules", learned.size(), seeded.size());
        return new Snapshot(Map.copyOf(byPattern), List.copyOf(learned), List.copyOf(seeded));
    }

    private static Optional<RegistryRule> firstContained(List<RegistryRule> rules, String looseDescription) {
        for (RegistryRule r : rules) {
            if (DescriptionNormalizer.containsTokens(looseDescription, r.pattern())) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    private record Snapshot(Map<String, RegistryRule> byPattern, List<RegistryRule> learned, List<RegistryRule> seeded) {
    }
}
