package com.spendlens.backend.classification.p2p;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.spendlens.backend.classification.model.P2pDirection;
import com.spendlens.backend.classification.registry.MerchantRuleRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Recognizes person-to-person transfers in UPI/NEFT/IMPS/wallet narrations.
 *
 * Each signal found in the narration contributes a score and the highest one wins. A result is
 * P2P at {@value #P2P_THRESHOLD} or above. Merchant markers (company suffixes, well-known
 * merchants, business UPI handles) veto the result. The detector never throws: a narration it
 * cannot read is simply not P2P.
 */
@Slf4j
@Component
public class TransferDetector {

    static final double P2P_THRESHOLD = 0.5;

    private static final Pattern UPI_MARKER = Pattern.compile("\\b(?:upi|vpa|gpay|phonepe|bhim)\\b");
    private static final Pattern SEGMENT_SPLIT = Pattern.compile("[/|]+");
    private static final Pattern CAMEL = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern UPI_PREFIX_SEPARATORS = Pattern.compile("[._\\-+]");
    private static final Pattern PERSON_NAME_CHARS = Pattern.compile("[A-Za-z][A-Za-z0-9 .]*");
    private static final Pattern ORG_PREFIX = Pattern.compile(
            "^(?:NEFT|IMPS|RTGS|UPI|CR|DR)[/\\-\\s]+\\d*[/\\-\\s]*", Pattern.CASE_INSENSITIVE);

    private final Predicate<String> knownMerchant;

    @Autowired
    public TransferDetector(MerchantRuleRegistry registry) {
        this(registry::containsKnownMerchant);
    }

    TransferDetector(Predicate<String> knownMerchant) {
        this.knownMerchant = knownMerchant;
    }

    /**
     * @param amount positive for debits, negative for credits; null is read as a debit
     */
    public TransferDetection detect(String description, BigDecimal amount) {
        if (description == null || description.isBlank()) {
            return TransferDetection.none("Empty description");
        }
        try {
            return evaluate(description.trim(), amount);
        } catch (RuntimeException e) {
            log.warn("[P2P] Detection failed for '{}': {}", description, e.getMessage());
            return TransferDetection.none("Detection error");
        }
    }

    private TransferDetection evaluate(String desc, BigDecimal amount) {
        String lower = desc.toLowerCase(Locale.ROOT);

        Optional<String> merchantSignal = TransferSignals.firstNotP2pSignal(lower);
        if (merchantSignal.isPresent()) {
            return TransferDetection.none("Merchant signal: '" + merchantSignal.get() + "'");
        }

        String mode = transferMode(lower);

        Optional<String> salary = TransferSignals.firstKeyword(TransferSignals.SALARY, lower);
        if (salary.isPresent()) {
            return new TransferDetection(true, P2pDirection.RECEIVED, extractOrgName(desc), null, 0.93,
                    mode, "income", label(P2pDirection.RECEIVED, mode, "income", "employer"),
                    "Salary keyword: '" + salary.get() + "'");
        }

        Signals s = new Signals();

        TransferSignals.firstKeyword(TransferSignals.FREELANCE, lower).ifPresent(kw -> {
            s.raise(0.8, "Freelance keyword: '" + kw + "'");
            s.relationship = "income";
            s.detail = "freelance";
        });

        String upiPrefix = null;
        Matcher upi = TransferSignals.UPI_ID.matcher(desc);
        if (upi.find()) {
            upiPrefix = upi.group(1);
            String handle = upi.group(2).toLowerCase(Locale.ROOT);
            s.handle = (upiPrefix + "@" + handle).toLowerCase(Locale.ROOT);
            mode = "upi";
            if (TransferSignals.BUSINESS_UPI_HANDLES.contains(handle)) {
                s.raise(0.15, "Business UPI handle: " + s.handle);
            } else if (TransferSignals.INDIVIDUAL_UPI_HANDLES.contains(handle)) {
                s.raise(0.88, "Individual UPI handle: " + s.handle);
            } else {
                s.raise(0.72, "UPI ID: " + s.handle);
            }
            if (upiPrefix.chars().noneMatch(Character::isDigit)) {
                s.name(upiToName(upiPrefix));
            }
        }

        Matcher phone = TransferSignals.PHONE.matcher(desc);
        if (phone.find()) {
            String number = phone.group(1);
            if (s.counterparty == null) {
                s.counterparty = "Contact " + number.substring(number.length() - 4);
            }
            if (upiPrefix != null && upiPrefix.contains(number)) {
                mode = "upi";
                s.raise(0.91, "Phone-based UPI: " + number);
            } else {
                s.raise(0.7, "Phone number: " + number);
            }
        }

        Matcher neft = TransferSignals.NEFT_NAME.matcher(desc);
        if (neft.find()) {
            String name = cleanName(neft.group(1));
            if (looksLikePersonName(name)) {
                s.name(name);
                s.raise(0.8, "NEFT/IMPS name: " + name);
            }
        }

        String segmentName = segmentName(desc);
        if (segmentName != null) {
            s.name(segmentName);
            s.raise(0.82, "UPI name: " + segmentName);
        }

        for (Pattern p : TransferSignals.P2P_APP_PATTERNS) {
            Matcher m = p.matcher(desc);
            if (m.find()) {
                mode = "upi";
                s.raise(0.75, "P2P app pattern");
                if (m.groupCount() >= 1 && m.group(1) != null) {
                    String name = cleanName(m.group(1));
                    if (looksLikePersonName(name)) s.name(name);
                }
                break;
            }
        }

        if (isKnownMerchant(s.counterparty) || isKnownMerchant(upiPrefix)) {
            return TransferDetection.none("Known merchant counterparty");
        }

        relationshipSignals(lower, s);

        if (s.confidence >= P2P_THRESHOLD && "unknown".equals(s.relationship)) {
            s.relationship = "personal";
        }

        if (s.confidence < 0.4 && TransferSignals.BARE_TRANSFER_REFERENCE.matcher(desc).find()) {
            s.raise(0.45, "Bare transfer reference");
        }

        if (s.confidence < P2P_THRESHOLD) {
            return TransferDetection.none(s.reasons.isEmpty() ? "Low confidence" : String.join(" | ", s.reasons));
        }

        P2pDirection direction = direction(lower, amount, s.relationship);
        double confidence = Math.round(s.confidence * 1000.0) / 1000.0;
        return new TransferDetection(true, direction, s.counterparty, s.handle, confidence, mode,
                s.relationship, label(direction, mode, s.relationship, s.detail), String.join(" | ", s.reasons));
    }

    private void relationshipSignals(String lower, Signals s) {
        Optional<String> family = TransferSignals.firstKeyword(TransferSignals.FAMILY, lower);
        family.ifPresent(kw -> {
            s.relationship = "personal";
            s.detail = "family";
            if (s.counterparty == null) s.counterparty = titleCase(kw);
            s.raise(0.72, "Family keyword: '" + kw + "'");
        });

        if ("unknown".equals(s.relationship)) {
            TransferSignals.firstKeyword(TransferSignals.FRIEND, lower).ifPresent(kw -> {
                s.relationship = "personal";
                s.detail = "friend";
                s.raise(0.68, "Friend keyword: '" + kw + "'");
            });
        }

        TransferSignals.firstKeyword(TransferSignals.RENT, lower).ifPresent(kw -> {
            s.relationship = "obligation";
            s.detail = "landlord";
            s.raise(0.7, "Rent keyword: '" + kw + "'");
        });

        TransferSignals.firstKeyword(TransferSignals.LOAN, lower).ifPresent(kw -> {
            if (!"obligation".equals(s.relationship)) {
                s.relationship = "obligation";
                s.detail = "loan";
            }
            s.raise(0.68, "Loan/settle keyword: '" + kw + "'");
        });

        TransferSignals.firstKeyword(TransferSignals.GIFT, lower).ifPresent(kw -> {
            s.relationship = "gift";
            s.detail = family.isPresent() ? "family" : "friend";
            s.raise(0.7, "Gift keyword: '" + kw + "'");
        });
    }

    private boolean isKnownMerchant(String candidate) {
        if (candidate == null || candidate.isBlank()) return false;
        return knownMerchant.test(candidate);
    }

    /**
     * A negative amount is always a credit. Otherwise an explicit received phrase wins unless the
     * narration also marks a debit.
     */
    static P2pDirection direction(String lower, BigDecimal amount, String relationship) {
        if ("income".equals(relationship)) return P2pDirection.RECEIVED;
        if (amount != null && amount.signum() < 0) return P2pDirection.RECEIVED;
        if (TransferSignals.RECEIVED_PHRASE.matcher(lower).find()
                && !TransferSignals.DEBIT_PHRASE.matcher(lower).find()) {
            return P2pDirection.RECEIVED;
        }
        return P2pDirection.SENT;
    }

    static String transferMode(String lower) {
        if (UPI_MARKER.matcher(lower).find()) return "upi";
        if (lower.contains("neft")) return "neft";
        if (lower.contains("imps")) return "imps";
        if (lower.contains("rtgs")) return "rtgs";
        if (lower.contains("upi")) return "upi";
        return "other";
    }

    static String label(P2pDirection direction, String mode, String relationship, String detail) {
        String modeLabel = "other".equals(mode) ? "Transfer" : mode.toUpperCase(Locale.ROOT);
        String dir = direction == P2pDirection.RECEIVED ? "Received" : "Sent";
        return modeLabel + " " + dir + " - " + relationshipLabel(relationship, detail);
    }

    private static String relationshipLabel(String relationship, String detail) {
        switch (relationship) {
            case "personal":
                return "Friends & Family";
            case "obligation":
                return "landlord".equals(detail) ? "Rent" : "Lending & Settling";
            case "income":
                if ("employer".equals(detail)) return "Salary";
                if ("freelance".equals(detail)) return "Freelance Income";
                return "Money Received";
            case "gift":
                return "Gift";
            default:
                return "P2P Transfer";
        }
    }

    /**
     * First slash-separated segment that reads like a person's name, e.g. "RAHUL SHARMA" in
     * {@code UPI/P2P/123456789/RAHUL SHARMA/rahul@okaxis}.
     */
    static String segmentName(String desc) {
        if (!desc.contains("/") && !desc.contains("|")) return null;
        for (String raw : SEGMENT_SPLIT.split(desc)) {
            String seg = raw.trim();
            if (seg.isEmpty() || seg.contains("@")) continue;
            if (TransferSignals.RAIL_TOKENS.contains(seg.toLowerCase(Locale.ROOT))) continue;
            if (seg.chars().filter(Character::isLetter).count() < 3) continue;
            String name = cleanName(seg);
            if (looksLikePersonName(name)) return name;
        }
        return null;
    }

    static String upiToName(String upiPrefix) {
        String spaced = CAMEL.matcher(upiPrefix).replaceAll("$1 $2");
        spaced = UPI_PREFIX_SEPARATORS.matcher(spaced).replaceAll(" ");
        List<String> parts = new ArrayList<>();
        for (String p : spaced.trim().split("\\s+")) {
            if (p.length() > 1) parts.add(capitalize(p));
            if (parts.size() == 3) break;
        }
        return parts.isEmpty() ? titleCase(upiPrefix) : String.join(" ", parts);
    }

    static boolean looksLikePersonName(String text) {
        if (text == null) return false;
        String t = text.trim();
        if (t.length() < 3 || !PERSON_NAME_CHARS.matcher(t).matches()) return false;
        String[] words = t.split("\\s+");
        if (words.length > 4) return false;
        for (String w : words) {
            if (w.chars().filter(Character::isDigit).count() > 1) return false;
            if (TransferSignals.RAIL_TOKENS.contains(w.toLowerCase(Locale.ROOT))) return false;
        }
        return TransferSignals.firstNotP2pSignal(t.toLowerCase(Locale.ROOT)).isEmpty();
    }

    /**
     * Drops trailing bank codes and IFSC tokens, then title-cases.
     */
    static String cleanName(String raw) {
        if (raw == null) return null;
        List<String> words = new ArrayList<>(Arrays.asList(raw.trim().split("\\s+")));
        while (words.size() > 1) {
            String last = words.get(words.size() - 1);
            String key = last.toLowerCase(Locale.ROOT).replace(".", "");
            if (TransferSignals.BANK_SUFFIXES.contains(key) || TransferSignals.IFSC.matcher(last).matches()) {
                words.remove(words.size() - 1);
            } else {
                break;
            }
        }
        return titleCase(String.join(" ", words));
    }

    static String extractOrgName(String desc) {
        String cleaned = ORG_PREFIX.matcher(desc).replaceFirst("").trim();
        String[] words = cleaned.split("[\\s/]+");
        List<String> out = new ArrayList<>();
        for (String w : words) {
            if (w.isBlank()) continue;
            out.add(capitalize(w));
            if (out.size() == 4) break;
        }
        return out.isEmpty() ? "Employer" : String.join(" ", out);
    }

    private static String titleCase(String text) {
        if (text == null || text.isBlank()) return text;
        List<String> out = new ArrayList<>();
        for (String w : text.trim().split("\\s+")) {
            out.add(capitalize(w));
        }
        return String.join(" ", out);
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) return word;
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static final class Signals {
        double confidence;
        String relationship = "unknown";
        String detail = "unknown";
        String counterparty;
        String handle;
        final List<String> reasons = new ArrayList<>();

        void raise(double score, String reason) {
            confidence = Math.max(confidence, score);
            reasons.add(reason);
        }

        void name(String name) {
            if (name != null && !name.isBlank()) counterparty = name;
        }
    }
}
