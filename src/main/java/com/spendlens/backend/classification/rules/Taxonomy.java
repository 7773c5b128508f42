package com.spendlens.backend.classification.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Category and subcategory names shared by the registry, the statistical corpus and the
 * inference prompts.
 */
public final class Taxonomy {

    private Taxonomy() {}

    public static final String UNCATEGORIZED = "Uncategorized";

    public static final Map<String, List<String>> CATEGORIES;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("Food & Dining", List.of(
                "Restaurants", "Food Delivery", "Fast Food", "Cafes & Coffee", "Street Food",
                "Groceries", "Bakeries", "Sweet Shops", "Juice Bars", "Alcohol & Beverages"));
        m.put("Shopping", List.of(
                "Electronics", "Clothing & Apparel", "Books & Stationery", "Home & Furniture",
                "Footwear", "Jewellery", "Gifts & Toys", "Grocery & Supermarket", "Pharmacy & Health Products"));
        m.put("Transportation", List.of(
                "Cab & Taxi", "Auto Rickshaw", "Metro & Train", "Bus", "Petrol & Fuel",
                "Parking", "Toll", "EV Charging", "Bike Rental", "Inter-city Bus"));
        m.put("Utilities & Bills", List.of(
                "Electricity", "Water", "Gas (PNG/LPG)", "Internet & Broadband",
                "Mobile Recharge", "DTH & Cable TV", "Society Maintenance"));
        m.put("Healthcare", List.of(
                "Hospitals & Clinics", "Pharmacy", "Diagnostic Labs", "Doctor Consultation",
                "Dental", "Optical", "Health Insurance"));
        m.put("Entertainment", List.of(
                "Movies & Cinema", "OTT Subscriptions", "Gaming", "Music & Concerts", "Sports Events"));
        m.put("Education", List.of(
                "School Fees", "College Fees", "Online Courses", "Coaching & Tuitions", "Books & Study Material"));
        m.put("Financial Services", List.of(
                "Loan EMI", "Credit Card Payment", "Insurance Premium", "Mutual Funds",
                "Stock Broking", "Fixed Deposits", "Gold Purchase"));
        m.put("Travel & Accommodation", List.of(
                "Hotels & Resorts", "Airbnb & Home Stays", "Flight Tickets", "Tour Packages", "Visa & Documentation"));
        m.put("Personal Care", List.of(
                "Salon & Spa", "Gym & Fitness", "Beauty & Cosmetics", "Laundry"));
        m.put("Home & Maintenance", List.of(
                "Rent", "Housekeeping", "Repairs", "Furniture & Decor", "Pest Control"));
        m.put("Subscriptions & Memberships", List.of(
                "Music Streaming", "Cloud Storage", "Software & SaaS", "Professional Memberships"));
        m.put("Transfers & Payments", List.of(
                "UPI Peer Transfer", "Bank Transfer", "Wallet Top-up", "Salary", "Freelance Payment Received"));
        m.put("Government & Taxes", List.of(
                "Income Tax", "GST Payment", "Property Tax", "Vehicle Tax", "Traffic Fine"));
        m.put("Charity & Donations", List.of(
                "NGO & Nonprofit", "Religious Donations", "Crowdfunding"));
        CATEGORIES = Collections.unmodifiableMap(m);
    }

    /**
     * Canonical spelling of a category name, matched case-insensitively.
     */
    public static Optional<String> canonicalCategory(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return CATEGORIES.keySet().stream()
                .filter(c -> c.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public static Optional<String> canonicalSubcategory(String category, String subcategory) {
        if (category == null || subcategory == null || subcategory.isBlank()) return Optional.empty();
        List<String> subs = CATEGORIES.get(category);
        if (subs == null) return Optional.empty();
        String wanted = subcategory.trim().toLowerCase(Locale.ROOT);
        return subs.stream()
                .filter(s -> s.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    /**
     * One line per category, used in inference prompts.
     */
    public static String promptSummary() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<String>> e : CATEGORIES.entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("- ").append(e.getKey()).append(": ").append(String.join(", ", e.getValue()));
        }
        return sb.toString();
    }
}
