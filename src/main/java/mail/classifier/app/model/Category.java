package mail.classifier.app.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of mail categories. The label is what gets persisted.
 */
public enum Category {
    GENERAL("General", Set.of("general")),
    INVOICE("Invoice", Set.of("invoice", "invoices")),
    CUSTOMER_REQUESTS("Customer Requests", Set.of("customer requests", "customer request")),
    MISC("Misc", Set.of("misc", "miscellaneous"));

    private final String label;
    private final Set<String> aliases;

    Category(String label, Set<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact (case-insensitive) lookup by label or known alias.
     * Returns empty for anything else; callers decide how to degrade.
     */
    public static Optional<Category> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.aliases.contains(key)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Lenient coercion used on model output: prefix and substring matching, General otherwise.
     */
    public static Category coerce(String value) {
        Optional<Category> exact = fromLabel(value);
        if (exact.isPresent()) {
            return exact.get();
        }
        String low = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (low.startsWith("invoice")) {
            return INVOICE;
        }
        if (low.startsWith("customer request")) {
            return CUSTOMER_REQUESTS;
        }
        if (low.contains("misc")) {
            return MISC;
        }
        return GENERAL;
    }
}
