package com.spendlens.backend.classification.p2p;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Rail markers and keyword tables used by {@link TransferDetector}.
 *
 * Keywords match on word boundaries of the lower-cased narration, so "sis" never fires inside
 * "analysis" and "inc" never fires inside "since".
 */
final class TransferSignals {

    private TransferSignals() {}

    static final Pattern UPI_ID = Pattern.compile(
            "\\b([a-z0-9._+\\-]{3,})@([a-z]{2,20})\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern PHONE = Pattern.compile("\\b([6-9]\\d{9})\\b");

    static final Pattern NEFT_NAME = Pattern.compile(
            "(?:NEFT|IMPS|RTGS)[/\\-\\s]+(?:[A-Z0-9]*\\d[A-Z0-9]*[/\\-\\s]+)?([A-Z][A-Z\\s.]{2,30}?)(?:[/\\-]|$)",
            Pattern.CASE_INSENSITIVE);

    static final Pattern BARE_TRANSFER_REFERENCE = Pattern.compile(
            "^(?:NEFT|IMPS|UPI|RTGS)[/\\-\\s]+\\d+", Pattern.CASE_INSENSITIVE);

    static final Pattern IFSC = Pattern.compile("^[A-Z]{4}0[A-Z0-9]{6}$", Pattern.CASE_INSENSITIVE);

    static final List<Pattern> P2P_APP_PATTERNS = List.of(
            Pattern.compile("(?:phonepe|gpay|google pay|paytm|bhim)\\s*(?:p2p|send|transfer|upi)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("pay to\\s+([A-Z][a-z]+(?:\\s[A-Z][a-z]+)*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:sent to|received from|transfer (?:to|from))\\s+([A-Z][a-z\\s]+)", Pattern.CASE_INSENSITIVE)
    );

    static final Pattern RECEIVED_PHRASE = Pattern.compile(
            "\\b(?:received from|credited|credit|cr|deposit|refund from)\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern DEBIT_PHRASE = Pattern.compile(
            "\\b(?:sent to|paid to|pay to|transfer to|debited|debit|dr|withdrawal)\\b", Pattern.CASE_INSENSITIVE);

    static final Set<String> INDIVIDUAL_UPI_HANDLES = Set.of(
            "okaxis", "oksbi", "okicici", "okhdfcbank", "ybl", "axl", "ibl", "apl", "waaxis",
            "naviaxis", "freecharge", "kotak", "indus", "rbl", "federal", "aubank", "idfc");

    static final Set<String> BUSINESS_UPI_HANDLES = Set.of(
            "razorpay", "cashfree", "paytmqr", "sbiepay", "hdfcbankltd");

    /** Path segments that name the rail, never the counterparty. */
    static final Set<String> RAIL_TOKENS = Set.of(
            "upi", "p2p", "p2m", "neft", "imps", "rtgs", "mob", "mb", "ib", "dr", "cr", "to", "from",
            "by", "transfer", "trf", "payment", "pay", "sent", "received", "ref", "na");

    /** Trailing tokens dropped from a counterparty name. */
    static final Set<String> BANK_SUFFIXES = Set.of(
            "bank", "hdfc", "hdfcbank", "sbi", "sbin", "icici", "icic", "axis", "utib", "kotak", "kkbk",
            "yesb", "yes", "pnb", "punb", "boi", "bkid", "canara", "cnrb", "idfc", "idfb", "indusind",
            "indb", "federal", "fdrl", "paytm", "pytm", "airtel", "airp", "ltd");

    static final List<String> SALARY = List.of(
            "salary", "sal", "payroll", "stipend", "wages", "monthly pay", "pay slip", "hr dept", "accounts dept");

    static final List<String> FREELANCE = List.of(
            "invoice", "payment for", "project", "freelance", "consulting", "client", "service charge",
            "professional fee");

    static final List<String> NOT_P2P = List.of(
            "pvt ltd", "private limited", "limited", "llp", "inc", "store", "shop", "mart", "enterprises",
            "traders", "agency", "services", "solutions", "technologies", "tech", "digital", "foods",
            "restaurant", "hotel", "school", "college", "hospital", "clinic", "pharmacy", "medical",
            "petrol", "pump", "motors", "amazon", "flipkart", "swiggy", "zomato", "razorpay", "cashfree",
            "instamojo", "billdesk");

    static final List<String> FAMILY = List.of(
            "mom", "maa", "mother", "dad", "papa", "father", "bhai", "brother", "didi", "sister", "sis",
            "bro", "wife", "husband", "beta", "beti", "son", "daughter", "chacha", "chachi", "mama", "mami",
            "nana", "nani", "dada", "dadi", "jiju", "family");

    static final List<String> FRIEND = List.of(
            "friend", "yaar", "dost", "buddy", "roommate", "flatmate", "colleague");

    static final List<String> RENT = List.of(
            "rent", "landlord", "owner", "flat", "house rent", "pg rent", "room rent");

    static final List<String> LOAN = List.of(
            "lent", "lend", "borrowed", "borrow", "loan", "loan repay", "settle", "settlement", "split", "owe");

    static final List<String> GIFT = List.of(
            "gift", "birthday", "anniversary", "wedding gift", "shaadi gift", "festival", "diwali", "eid",
            "holi", "navratri", "rakhi", "christmas");

    private static final Map<String, Pattern> KEYWORD_PATTERNS = new ConcurrentHashMap<>();

    static Optional<String> firstKeyword(List<String> keywords, String lowerText) {
        for (String kw : keywords) {
            if (wordPattern(kw).matcher(lowerText).find()) {
                return Optional.of(kw);
            }
        }
        return Optional.empty();
    }

    /**
     * First company suffix or merchant word in the narration, if any.
     */
    static Optional<String> firstNotP2pSignal(String lowerText) {
        return firstKeyword(NOT_P2P, lowerText);
    }

    private static Pattern wordPattern(String keyword) {
        return KEYWORD_PATTERNS.computeIfAbsent(keyword, k ->
                Pattern.compile("(?<![a-z0-9])" + Pattern.quote(k.toLowerCase(Locale.ROOT)) + "(?![a-z0-9])"));
    }
}
