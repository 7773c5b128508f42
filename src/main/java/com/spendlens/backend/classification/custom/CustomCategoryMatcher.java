package com.spendlens.backend.classification.custom;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.stereotype.Service;

import com.spendlens.backend.classification.entity.CustomCategory;
import com.spendlens.backend.classification.entity.CustomCategoryRule;
import com.spendlens.backend.classification.entity.CustomRuleType;
import com.spendlens.backend.classification.model.Transaction;
import com.spendlens.backend.exceptions.InvalidInputException;
import com.spendlens.backend.exceptions.RegistryUnavailableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Matches transactions against the user's custom categories.
 *
 * Rules of a category are evaluated strongest first. Each matched rule adds
 * {@code 11 - priority} to the category's score and an exclusive match stops the evaluation.
 * The highest score wins; ties go to the oldest category. Reads come from a snapshot reloaded
 * after every create.
 */
@Slf4j
@Service
public class CustomCategoryMatcher {

    static final int DEFAULT_PRIORITY = 5;
    private static final int MAX_TAGS = 20;

    private final CustomCategoryStore store;

    private volatile List<CompiledCategory> snapshot;

    public CustomCategoryMatcher(CustomCategoryStore store) {
        this.store = store;
    }

    /**
     * Never throws: an unreachable store means no custom category applies.
     *
     * @param merchantName     merchant resolved by the engine, may be null
     * @param originalCategory category decided by the engine, may be null
     */
    public Optional<CustomCategoryMatch> match(Transaction tx, String merchantName, String originalCategory) {
        List<CompiledCategory> categories;
        try {
            categories = current();
        } catch (RegistryUnavailableException e) {
            log.warn("[Custom] Matching skipped, store unavailable: {}", e.getMessage());
            return Optional.empty();
        }
        if (categories.isEmpty()) return Optional.empty();

        Subject subject = new Subject(tx, merchantName, originalCategory);
        CustomCategoryMatch best = null;
        for (CompiledCategory category : categories) {
            CustomCategoryMatch m = category.evaluate(subject);
            if (m != null && (best == null || m.score() > best.score())) {
                best = m;
            }
        }
        return Optional.ofNullable(best);
    }

    public CustomCategory create(CustomCategoryCommand command) {
        String name = command.name() == null ? "" : command.name().trim();
        if (name.isEmpty()) {
            throw new InvalidInputException("name is required");
        }
        if (command.rules().isEmpty()) {
            throw new InvalidInputException("at least one rule is required");
        }
        if (store.existsByName(name)) {
            throw new InvalidInputException("Custom category '" + name + "' already exists");
        }

        List<CustomCategoryRule> rules = new ArrayList<>();
        for (CustomCategoryCommand.Rule r : command.rules()) {
            CustomCategoryRule rule = toRule(r);
            compile(rule);
            rules.add(rule);
        }

        CustomCategory saved = store.save(CustomCategory.builder()
                .name(name)
                .description(command.description())
                .tags(normalizeTags(command.tags()))
                .rules(rules)
                .active(true)
                .build());

        invalidate();
        log.info("[Custom] Created custom category '{}' ({} rules, tags={})", name, rules.size(), saved.getTags());
        return saved;
    }

    public List<CustomCategory> list() {
        return store.findAll();
    }

    public void invalidate() {
        snapshot = null;
    }

    private List<CompiledCategory> current() {
        List<CompiledCategory> s = snapshot;
        if (s != null) return s;

        synchronized (this) {
            if (snapshot != null) return snapshot;
            snapshot = load();
            return snapshot;
        }
    }

    private List<CompiledCategory> load() {
        List<CompiledCategory> out = new ArrayList<>();
        for (CustomCategory c : store.findActive()) {
            List<CompiledRule> rules = new ArrayList<>();
            for (CustomCategoryRule r : c.getRules()) {
                try {
                    rules.add(compile(r));
                } catch (InvalidInputException e) {
                    log.warn("[Custom] Skipping invalid rule in '{}': {}", c.getName(), e.getMessage());
                }
            }
            if (rules.isEmpty()) continue;
            rules.sort(Comparator.comparingInt(CompiledRule::priority));
            out.add(new CompiledCategory(c.getName(), Set.copyOf(c.getTags()), List.copyOf(rules)));
        }
        log.debug("[Custom] Snapshot loaded: {} active categories", out.size());
        return List.copyOf(out);
    }

    private static CustomCategoryRule toRule(CustomCategoryCommand.Rule r) {
        if (r == null || r.type() == null) {
            throw new InvalidInputException("rule type is required");
        }
        int priority = r.priority() == null ? DEFAULT_PRIORITY : r.priority();
        if (priority < 1 || priority > 10) {
            throw new InvalidInputException("rule priority must be between 1 and 10");
        }
        return CustomCategoryRule.builder()
                .type(r.type())
                .value(r.value() == null ? null : r.value().trim())
                .minAmount(r.minAmount())
                .maxAmount(r.maxAmount())
                .priority(priority)
                .exclusive(r.exclusive())
                .build();
    }

    static CompiledRule compile(CustomCategoryRule r) {
        CustomRuleType type = r.getType();
        String value = r.getValue();
        BigDecimal min = r.getMinAmount();
        BigDecimal max = r.getMaxAmount();

        switch (type) {
            case KEYWORD, MERCHANT, ORIGINAL_CATEGORY -> {
                if (value == null || value.isBlank()) {
                    throw new InvalidInputException(type + " rule needs a value");
                }
                return new CompiledRule(type, value.toLowerCase(Locale.ROOT), null, null, null, null,
                        r.getPriority(), r.isExclusive());
            }
            case REGEX -> {
                if (value == null || value.isBlank()) {
                    throw new InvalidInputException("REGEX rule needs a pattern");
                }
                try {
                    return new CompiledRule(type, value, Pattern.compile(value, Pattern.CASE_INSENSITIVE), null,
                            null, null, r.getPriority(), r.isExclusive());
                } catch (PatternSyntaxException e) {
                    throw new InvalidInputException("Invalid regex '" + value + "': " + e.getDescription());
                }
            }
            case DAY_OF_WEEK -> {
                try {
                    DayOfWeek day = DayOfWeek.valueOf(value == null ? "" : value.trim().toUpperCase(Locale.ROOT));
                    return new CompiledRule(type, value, null, day, null, null, r.getPriority(), r.isExclusive());
                } catch (IllegalArgumentException e) {
                    throw new InvalidInputException("Invalid day of week '" + value + "'");
                }
            }
            case AMOUNT_RANGE -> {
                if (min == null || max == null || min.compareTo(max) > 0) {
                    throw new InvalidInputException("AMOUNT_RANGE rule needs minAmount <= maxAmount");
                }
            }
            case AMOUNT_ABOVE -> {
                if (min == null) throw new InvalidInputException("AMOUNT_ABOVE rule needs minAmount");
            }
            case AMOUNT_BELOW -> {
                if (max == null) throw new InvalidInputException("AMOUNT_BELOW rule needs maxAmount");
            }
        }
        return new CompiledRule(type, null, null, null, min, max, r.getPriority(), r.isExclusive());
    }

    private static Set<String> normalizeTags(List<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : tags) {
            if (t == null || t.isBlank()) continue;
            out.add(t.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-"));
        }
        if (out.size() > MAX_TAGS) {
            throw new InvalidInputException("at most " + MAX_TAGS + " tags are allowed");
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Snapshot types
    // ---------------------------------------------------------------------

    private record Subject(String description, String merchant, String category, BigDecimal amount, DayOfWeek day) {

        Subject(Transaction tx, String merchant, String category) {
            this(lower(tx.description()), lower(merchant), lower(category),
                    tx.amount() == null ? null : tx.amount().abs(),
                    tx.date() == null ? null : tx.date().getDayOfWeek());
        }

        private static String lower(String s) {
            return s == null ? null : s.toLowerCase(Locale.ROOT);
        }
    }

    record CompiledRule(CustomRuleType type, String value, Pattern regex, DayOfWeek day,
                        BigDecimal min, BigDecimal max, int priority, boolean exclusive) {

        private boolean test(Subject s) {
            return switch (type) {
                case KEYWORD -> s.description() != null && s.description().contains(value);
                case MERCHANT -> s.merchant() != null && s.merchant().contains(value);
                case ORIGINAL_CATEGORY -> s.category() != null && s.category().contains(value);
                case REGEX -> s.description() != null && regex.matcher(s.description()).find();
                case DAY_OF_WEEK -> day == s.day();
                case AMOUNT_RANGE -> s.amount() != null && s.amount().compareTo(min) >= 0 && s.amount().compareTo(max) <= 0;
                case AMOUNT_ABOVE -> s.amount() != null && s.amount().compareTo(min) > 0;
                case AMOUNT_BELOW -> s.amount() != null && s.amount().compareTo(max) < 0;
            };
        }
    }

    private record CompiledCategory(String name, Set<String> tags, List<CompiledRule> rules) {

        CustomCategoryMatch evaluate(Subject subject) {
            int score = 0;
            int matched = 0;
            for (CompiledRule rule : rules) {
                if (!rule.test(subject)) continue;
                matched++;
                score += 11 - rule.priority();
                if (rule.exclusive()) break;
            }
            return matched == 0 ? null : new CustomCategoryMatch(name, tags, score, matched);
        }
    }
}
