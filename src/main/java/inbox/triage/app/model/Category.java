package inbox.triage.app.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed category taxonomy the classifier verdict is mapped onto.
 * Each category belongs to exactly one tier and owns exactly one canonical label.
 */
public enum Category {
    URGENT("urgent", Tier.ACTION, "Urgent",
            "Needs a response or action within 24 hours (deadlines, outages, time-critical requests)"),
    TODO("todo", Tier.ACTION, "To Do",
            "Asks the reader to do something without an immediate deadline"),
    WAITING("waiting", Tier.ACTION, "Waiting",
            "The reader is waiting on someone else (confirmations of requests, pending replies)"),
    SECURITY_ALERT("security_alert", Tier.ACTION, "Security Alert",
            "Sign-in alerts, password resets, 2FA codes, suspicious activity notices"),
    CREATOR_NEWSLETTERS("creator_newsletters", Tier.REFERENCE, "Newsletters",
            "Editorial newsletters written by a person or publication (Substack, blogs, digests)"),
    SOCIAL_COMMUNITY("social_community", Tier.REFERENCE, "Social",
            "Notifications from social networks, forums and community platforms"),
    PROMOTIONS("promotions", Tier.REFERENCE, "Promotions",
            "Marketing, sales, discounts and product announcements"),
    FINANCIAL("financial", Tier.REFERENCE, "Financial",
            "Bank statements, invoices, bills, tax and payment notices"),
    PURCHASES("purchases", Tier.REFERENCE, "Purchases",
            "Order confirmations, receipts, shipping and delivery updates"),
    MISC("misc", Tier.REFERENCE, "Misc",
            "Anything that does not clearly fit another category");

    private static final Set<String> MANAGED_LABEL_NAMES = Collections.unmodifiableSet(
            Arrays.stream(values()).map(Category::getLabelName).collect(Collectors.toSet()));

    private final String wireName;
    private final Tier tier;
    private final String labelName;
    private final String definition;

    Category(String wireName, Tier tier, String labelSuffix, String definition) {
        this.wireName = wireName;
        this.tier = tier;
        this.labelName = tier.getLabelPrefix() + "/" + labelSuffix;
        this.definition = definition;
    }

    public String getWireName() {
        return wireName;
    }

    public Tier getTier() {
        return tier;
    }

    public String getLabelName() {
        return labelName;
    }

    public String getDefinition() {
        return definition;
    }

    public boolean isActionTier() {
        return tier == Tier.ACTION;
    }

    /**
     * Looks up a category by the name the classifier uses for it.
     * Matching ignores case and surrounding whitespace.
     */
    public static Optional<Category> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.wireName.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Every label name the engine owns. Labels outside this set are never touched.
     */
    public static Set<String> managedLabelNames() {
        return MANAGED_LABEL_NAMES;
    }

    public static boolean isManagedLabel(String labelName) {
        return labelName != null && MANAGED_LABEL_NAMES.contains(labelName);
    }
}
