package com.spendlens.backend.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Built-in merchant aliases loaded into the registry as {@code seed} rules.
 *
 * Each alias becomes one registry pattern (loose-normalized). Aliases that are ambiguous on their
 * own carry a confidence below the default review threshold, so they only count as a partial match.
 */
public final class SeedMerchants {

    private SeedMerchants() {}

    public static final double DEFAULT_CONFIDENCE = 0.95;

    public record SeedMerchant(String name, String category, String subcategory, double confidence, List<String> aliases) {
        public SeedMerchant {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
            if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
            if (confidence < 0.0 || confidence > 1.0) throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            if (aliases == null || aliases.isEmpty()) throw new IllegalArgumentException("aliases is required");
            aliases = List.copyOf(aliases);
        }
    }

    public static final List<SeedMerchant> MERCHANTS;

    static {
        List<SeedMerchant> items = new ArrayList<>();

        // Food delivery / quick commerce
        items.add(merchant("Zomato", "Food & Dining", "Food Delivery", "zomato", "zomato order", "zomato food", "zmt"));
        items.add(merchant("Swiggy", "Food & Dining", "Food Delivery", "swiggy", "swiggy order", "bundl technologies", "swiggy instamart"));
        items.add(merchant("Blinkit", "Food & Dining", "Groceries", "blinkit", "grofers"));
        items.add(merchant("Zepto", "Food & Dining", "Groceries", "zepto", "kiranakart"));
        items.add(merchant("BigBasket", "Food & Dining", "Groceries", "bigbasket", "innovative retail"));
        items.add(merchant("Dunzo", "Food & Dining", "Groceries", "dunzo"));
        items.add(merchant("Country Delight", "Food & Dining", "Groceries", "country delight", "countrydelight"));
        items.add(merchant("Domino's Pizza", "Food & Dining", "Fast Food", "dominos", "domino s", "jubilant foodworks"));
        items.add(merchant("McDonald's", "Food & Dining", "Fast Food", "mcdonalds", "mcdonald s", "hardcastle restaurants"));
        items.add(merchant("Burger King", "Food & Dining", "Fast Food", "burger king"));
        items.add(merchant("KFC", "Food & Dining", "Fast Food", "kfc", "devyani international"));
        items.add(merchant("Pizza Hut", "Food & Dining", "Fast Food", "pizza hut", "pizzahut"));
        items.add(merchant("Starbucks", "Food & Dining", "Cafes & Coffee", "starbucks", "tata starbucks"));
        items.add(merchant("Cafe Coffee Day", "Food & Dining", "Cafes & Coffee", "cafe coffee day", "ccd", "coffee day"));
        items.add(merchant("Chaayos", "Food & Dining", "Cafes & Coffee", "chaayos"));
        items.add(merchant("Third Wave Coffee", "Food & Dining", "Cafes & Coffee", "third wave coffee", "thirdwave"));
        items.add(merchant("Haldiram's", "Food & Dining", "Sweet Shops", "haldirams", "haldiram"));

        // E-commerce
        items.add(ambiguous("Amazon", "Shopping", "Electronics", 0.65, "amazon", "amzn", "amazon in"));
        items.add(merchant("Amazon Pay", "Transfers & Payments", "Wallet Top-up", "amazon pay", "amazonpay"));
        items.add(ambiguous("Flipkart", "Shopping", "Electronics", 0.65, "flipkart"));
        items.add(merchant("Flipkart Supermart", "Shopping", "Grocery & Supermarket", "flipkart supermart"));
        items.add(merchant("Myntra", "Shopping", "Clothing & Apparel", "myntra"));
        items.add(merchant("Ajio", "Shopping", "Clothing & Apparel", "ajio", "reliance ajio"));
        items.add(merchant("Meesho", "Shopping", "Clothing & Apparel", "meesho", "fashnear"));
        items.add(merchant("Nykaa", "Personal Care", "Beauty & Cosmetics", "nykaa", "fsn e commerce"));
        items.add(merchant("JioMart", "Food & Dining", "Groceries", "jiomart", "jio mart"));
        items.add(merchant("Croma", "Shopping", "Electronics", "croma", "infiniti retail"));
        items.add(merchant("Reliance Digital", "Shopping", "Electronics", "reliance digital"));
        items.add(merchant("D-Mart", "Shopping", "Grocery & Supermarket", "dmart", "d mart", "avenue supermarts"));
        items.add(merchant("Reliance Fresh", "Shopping", "Grocery & Supermarket", "reliance fresh", "reliance smart"));
        items.add(ambiguous("More Retail", "Shopping", "Grocery & Supermarket", 0.55, "more retail", "more supermarket"));
        items.add(merchant("Westside", "Shopping", "Clothing & Apparel", "westside"));
        items.add(merchant("Pantaloons", "Shopping", "Clothing & Apparel", "pantaloons"));
        items.add(merchant("Crossword", "Shopping", "Books & Stationery", "crossword bookstores", "crossword"));

        // Transportation
        items.add(merchant("Uber", "Transportation", "Cab & Taxi", "uber", "uber india", "uber trip"));
        items.add(merchant("Ola", "Transportation", "Cab & Taxi", "olacabs", "ola cabs", "ani technologies"));
        items.add(merchant("Rapido", "Transportation", "Bike Rental", "rapido", "roppen transportation"));
        items.add(merchant("Namma Metro", "Transportation", "Metro & Train", "namma metro", "bmrcl"));
        items.add(merchant("IRCTC", "Transportation", "Metro & Train", "irctc", "indian railway"));
        items.add(merchant("RedBus", "Transportation", "Inter-city Bus", "redbus"));
        items.add(merchant("HP Petrol", "Transportation", "Petrol & Fuel", "hp petrol", "hindustan petroleum", "hpcl"));
        items.add(merchant("Indian Oil", "Transportation", "Petrol & Fuel", "indian oil", "iocl"));
        items.add(merchant("Bharat Petroleum", "Transportation", "Petrol & Fuel", "bharat petroleum", "bpcl"));
        items.add(merchant("FASTag", "Transportation", "Toll", "fastag", "netc fastag"));

        // Travel
        items.add(merchant("IndiGo", "Travel & Accommodation", "Flight Tickets", "indigo", "interglobe aviation"));
        items.add(merchant("Air India", "Travel & Accommodation", "Flight Tickets", "air india"));
        items.add(merchant("SpiceJet", "Travel & Accommodation", "Flight Tickets", "spicejet"));
        items.add(merchant("MakeMyTrip", "Travel & Accommodation", "Tour Packages", "makemytrip", "mmt"));
        items.add(merchant("Goibibo", "Travel & Accommodation", "Tour Packages", "goibibo"));
        items.add(merchant("OYO", "Travel & Accommodation", "Hotels & Resorts", "oyo", "oyo rooms", "oravel stays"));
        items.add(merchant("Airbnb", "Travel & Accommodation", "Airbnb & Home Stays", "airbnb"));

        // Utilities
        items.add(merchant("Airtel", "Utilities & Bills", "Mobile Recharge", "airtel", "bharti airtel"));
        items.add(merchant("Airtel Broadband", "Utilities & Bills", "Internet & Broadband", "airtel broadband", "airtel xstream fiber"));
        items.add(merchant("Jio", "Utilities & Bills", "Mobile Recharge", "jio recharge", "reliance jio", "rjio"));
        items.add(merchant("Vi", "Utilities & Bills", "Mobile Recharge", "vodafone idea", "vi recharge"));
        items.add(merchant("BSNL", "Utilities & Bills", "Mobile Recharge", "bsnl"));
        items.add(merchant("Tata Play", "Utilities & Bills", "DTH & Cable TV", "tata play", "tata sky", "tataplay"));
        items.add(merchant("ACT Fibernet", "Utilities & Bills", "Internet & Broadband", "act fibernet", "atria convergence"));
        items.add(merchant("BESCOM", "Utilities & Bills", "Electricity", "bescom"));
        items.add(merchant("MSEDCL", "Utilities & Bills", "Electricity", "msedcl", "mseb"));
        items.add(merchant("Tata Power", "Utilities & Bills", "Electricity", "tata power", "tpddl"));
        items.add(merchant("Indraprastha Gas", "Utilities & Bills", "Gas (PNG/LPG)", "indraprastha gas", "igl"));
        items.add(merchant("Indane", "Utilities & Bills", "Gas (PNG/LPG)", "indane", "hp gas"));

        // Entertainment / subscriptions
        items.add(merchant("Netflix", "Entertainment", "OTT Subscriptions", "netflix", "nflx"));
        items.add(merchant("Amazon Prime", "Entertainment", "OTT Subscriptions", "amazon prime", "prime video"));
        items.add(merchant("Disney+ Hotstar", "Entertainment", "OTT Subscriptions", "hotstar", "disney hotstar"));
        items.add(merchant("SonyLIV", "Entertainment", "OTT Subscriptions", "sonyliv", "sony liv"));
        items.add(merchant("Zee5", "Entertainment", "OTT Subscriptions", "zee5"));
        items.add(merchant("Spotify", "Subscriptions & Memberships", "Music Streaming", "spotify"));
        items.add(merchant("JioSaavn", "Subscriptions & Memberships", "Music Streaming", "jiosaavn", "saavn"));
        items.add(merchant("PVR INOX", "Entertainment", "Movies & Cinema", "pvr", "pvr inox", "inox"));
        items.add(merchant("BookMyShow", "Entertainment", "Movies & Cinema", "bookmyshow", "bigtree entertainment"));
        items.add(ambiguous("BookMyShow", "Entertainment", "Movies & Cinema", 0.60, "bms"));
        items.add(merchant("Dream11", "Entertainment", "Gaming", "dream11", "sporta technologies"));
        items.add(merchant("Google One", "Subscriptions & Memberships", "Cloud Storage", "google one"));
        items.add(ambiguous("Google", "Subscriptions & Memberships", "Software & SaaS", 0.60, "google", "goog"));
        items.add(merchant("Microsoft", "Subscriptions & Memberships", "Software & SaaS", "microsoft", "office 365", "microsoft 365"));
        items.add(merchant("Adobe", "Subscriptions & Memberships", "Software & SaaS", "adobe"));

        // Healthcare
        items.add(merchant("Apollo Pharmacy", "Healthcare", "Pharmacy", "apollo pharmacy"));
        items.add(ambiguous("Apollo", "Healthcare", "Hospitals & Clinics", 0.60, "apollo"));
        items.add(merchant("Tata 1mg", "Healthcare", "Pharmacy", "1mg", "tata 1mg"));
        items.add(merchant("PharmEasy", "Healthcare", "Pharmacy", "pharmeasy"));
        items.add(merchant("Netmeds", "Healthcare", "Pharmacy", "netmeds"));
        items.add(merchant("Practo", "Healthcare", "Doctor Consultation", "practo"));
        items.add(merchant("Dr Lal PathLabs", "Healthcare", "Diagnostic Labs", "lal pathlabs", "dr lal pathlabs"));
        items.add(merchant("Thyrocare", "Healthcare", "Diagnostic Labs", "thyrocare"));
        items.add(merchant("Star Health", "Healthcare", "Health Insurance", "star health"));

        // Education
        items.add(merchant("BYJU'S", "Education", "Online Courses", "byjus", "byju s", "think and learn"));
        items.add(merchant("Unacademy", "Education", "Coaching & Tuitions", "unacademy"));
        items.add(merchant("Coursera", "Education", "Online Courses", "coursera"));
        items.add(merchant("upGrad", "Education", "Online Courses", "upgrad"));

        // Financial services
        items.add(merchant("Zerodha", "Financial Services", "Stock Broking", "zerodha"));
        items.add(merchant("Groww", "Financial Services", "Mutual Funds", "groww", "nextbillion technology"));
        items.add(merchant("Upstox", "Financial Services", "Stock Broking", "upstox", "rksv securities"));
        items.add(merchant("LIC", "Financial Services", "Insurance Premium", "lic premium", "life insurance corporation"));
        items.add(merchant("HDFC Life", "Financial Services", "Insurance Premium", "hdfc life"));
        items.add(merchant("Bajaj Finance", "Financial Services", "Loan EMI", "bajaj finance", "bajaj finserv"));
        items.add(merchant("CRED", "Financial Services", "Credit Card Payment", "cred club", "cred pay"));
        items.add(merchant("SBI Card", "Financial Services", "Credit Card Payment", "sbi card", "sbi credit card"));
        items.add(merchant("HDFC Credit Card", "Financial Services", "Credit Card Payment", "hdfc credit card", "hdfc card"));

        // Personal care / home
        items.add(merchant("Cult.fit", "Personal Care", "Gym & Fitness", "cult fit", "curefit", "cultfit"));
        items.add(merchant("Urban Company", "Home & Maintenance", "Housekeeping", "urban company", "urbanclap"));
        items.add(merchant("NoBroker", "Home & Maintenance", "Rent", "nobroker"));

        // Government
        items.add(merchant("Income Tax Department", "Government & Taxes", "Income Tax", "income tax", "tin nsdl"));
        items.add(merchant("GST Portal", "Government & Taxes", "GST Payment", "gstn", "gst payment"));
        items.add(merchant("Traffic Challan", "Government & Taxes", "Traffic Fine", "e challan", "echallan", "traffic challan"));

        MERCHANTS = Collections.unmodifiableList(items);
    }

    private static SeedMerchant merchant(String name, String category, String subcategory, String... aliases) {
        return new SeedMerchant(name, category, subcategory, DEFAULT_CONFIDENCE, List.of(aliases));
    }

    private static SeedMerchant ambiguous(String name, String category, String subcategory, double confidence, String... aliases) {
        return new SeedMerchant(name, category, subcategory, confidence, List.of(aliases));
    }
}
