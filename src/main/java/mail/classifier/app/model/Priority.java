package mail.classifier.app.model;

import java.util.Locale;

public enum Priority {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Anything outside High/Medium/Low becomes Low. */
    public static Priority coerce(String value) {
        if (value != null) {
            String key = value.trim().toLowerCase(Locale.ROOT);
            for (Priority priority : values()) {
                if (priority.label.toLowerCase(Locale.ROOT).equals(key)) {
                    return priority;
                }
            }
        }
        return LOW;
    }
}
