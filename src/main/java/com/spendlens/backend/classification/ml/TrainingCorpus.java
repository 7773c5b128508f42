package com.spendlens.backend.classification.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Phrases the statistical classifier is trained on at startup.
 *
 * Transaction phrases come first, then product phrases used to classify split line items.
 */
public final class TrainingCorpus {

    private TrainingCorpus() {}

    public static final List<TrainingExample> SEED;

    static {
        List<TrainingExample> items = new ArrayList<>();

        // transaction narrations
        add(items, "Food & Dining", "Food Delivery", "zomato order food delivery", "swiggy bundl technologies food order");
        add(items, "Food & Dining", "Groceries",
                "blinkit quick commerce grocery", "zepto order groceries", "bigbasket order fresh vegetables");
        add(items, "Food & Dining", "Fast Food", "dominos pizza order", "mcdonalds burger restaurant");
        add(items, "Food & Dining", "Cafes & Coffee", "starbucks coffee purchase");
        add(items, "Food & Dining", "Restaurants", "restaurant dinner bill", "family dinner restaurant bill");
        add(items, "Transportation", "Cab & Taxi", "uber cab ride bangalore", "ola cabs auto rickshaw");
        add(items, "Transportation", "Bike Rental", "rapido bike taxi commute");
        add(items, "Transportation", "Metro & Train", "irctc train ticket booking", "metro card recharge");
        add(items, "Transportation", "Petrol & Fuel", "petrol pump fuel refill");
        add(items, "Transportation", "Toll", "fastag toll highway");
        add(items, "Transportation", "Inter-city Bus", "redbus bus ticket booking");
        add(items, "Travel & Accommodation", "Flight Tickets", "indigo airline ticket");
        add(items, "Travel & Accommodation", "Tour Packages", "makemytrip flight hotel booking");
        add(items, "Travel & Accommodation", "Hotels & Resorts", "oyo rooms hotel stay");
        add(items, "Utilities & Bills", "Mobile Recharge", "airtel prepaid recharge", "jio recharge plan");
        add(items, "Utilities & Bills", "Electricity", "electricity bill bescom payment");
        add(items, "Utilities & Bills", "Gas (PNG/LPG)", "gas bill igl png payment");
        add(items, "Utilities & Bills", "Internet & Broadband", "broadband internet bill act fibernet");
        add(items, "Entertainment", "OTT Subscriptions",
                "netflix subscription monthly", "hotstar disney premium", "spotify premium music");
        add(items, "Entertainment", "Movies & Cinema", "pvr cinemas movie ticket", "bookmyshow event ticket concert");
        add(items, "Entertainment", "Gaming", "dream11 fantasy cricket");
        add(items, "Healthcare", "Pharmacy", "apollo pharmacy medicine", "1mg online pharmacy order");
        add(items, "Healthcare", "Doctor Consultation", "practo doctor consultation");
        add(items, "Healthcare", "Diagnostic Labs", "dr lal pathlabs blood test");
        add(items, "Education", "Online Courses", "byjus subscription education");
        add(items, "Education", "Coaching & Tuitions", "unacademy plus subscription");
        add(items, "Education", "School Fees", "school fees tuition payment");
        add(items, "Financial Services", "Stock Broking", "zerodha brokerage trading");
        add(items, "Financial Services", "Mutual Funds", "groww mutual fund sip");
        add(items, "Financial Services", "Insurance Premium", "lic premium insurance payment");
        add(items, "Financial Services", "Loan EMI", "loan emi bajaj finserv payment");
        add(items, "Financial Services", "Credit Card Payment", "hdfc credit card bill payment");
        add(items, "Shopping", "Electronics",
                "amazon india shopping electronics", "flipkart purchase mobile phone", "croma electronics purchase");
        add(items, "Shopping", "Clothing & Apparel", "myntra fashion clothing purchase", "meesho order clothing");
        add(items, "Shopping", "Grocery & Supermarket", "dmart supermarket grocery shop", "reliance fresh grocery purchase");
        add(items, "Shopping", "Books & Stationery", "book purchase stationery store");
        add(items, "Personal Care", "Beauty & Cosmetics", "nykaa beauty cosmetics order");
        add(items, "Personal Care", "Gym & Fitness", "cult fit gym membership");
        add(items, "Home & Maintenance", "Housekeeping", "urban company home services");
        add(items, "Home & Maintenance", "Rent", "rent payment monthly home");
        add(items, "Government & Taxes", "Income Tax", "income tax payment tds");
        add(items, "Government & Taxes", "GST Payment", "gst payment gstn portal");
        add(items, "Transfers & Payments", "UPI Peer Transfer", "upi transfer send money");
        add(items, "Transfers & Payments", "Wallet Top-up", "paytm wallet topup");
        add(items, "Charity & Donations", "NGO & Nonprofit", "donation charity ngo");
        add(items, "Charity & Donations", "Religious Donations", "temple donation religious");
        add(items, "Subscriptions & Memberships", "Cloud Storage", "google one storage subscription");
        add(items, "Subscriptions & Memberships", "Software & SaaS", "microsoft office 365 subscription");
        items.add(new TrainingExample("salary credit employer", "Transfers & Payments", "Salary", true));
        items.add(new TrainingExample("freelance invoice payment received client", "Transfers & Payments",
                "Freelance Payment Received", true));

        // split line items
        add(items, "Shopping", "Electronics",
                "mobile phone", "smartphone", "laptop", "charger", "headphones", "earphones", "power bank", "usb cable");
        add(items, "Shopping", "Clothing & Apparel", "shirt", "t shirt", "jeans", "kurta", "saree", "jacket");
        add(items, "Shopping", "Footwear", "shoes", "sandals", "sneakers", "slippers");
        add(items, "Shopping", "Books & Stationery", "book", "notebook", "stationery", "pens");
        add(items, "Shopping", "Home & Furniture", "bedsheet", "cushion", "table lamp");
        add(items, "Personal Care", "Beauty & Cosmetics", "shampoo", "face wash", "lipstick");
        add(items, "Food & Dining", "Groceries", "rice", "atta", "milk", "vegetables", "fruits");

        SEED = Collections.unmodifiableList(items);
    }

    private static void add(List<TrainingExample> out, String category, String subcategory, String... phrases) {
        for (String p : phrases) {
            out.add(new TrainingExample(p, category, subcategory));
        }
    }
}
