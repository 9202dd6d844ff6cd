package mail.classifier.app.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The category-gated field set patched into a persisted record.
 * {@code fields} holds only the keys allowed for the category; values may be null.
 */
@Value
public class EnrichmentResult {
    String category;
    String priority;
    Map<String, String> fields;

    public EnrichmentResult(String category, String priority, Map<String, String> fields) {
        this.category = category;
        this.priority = priority;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static EnrichmentResult labelsOnly(String category, String priority) {
        return new EnrichmentResult(category, priority, Map.of());
    }

    public static EnrichmentResult of(Classification classification) {
        return labelsOnly(classification.getCategory().getLabel(), classification.getPriority().getLabel());
    }

    /** category, priority and the allowed fields as one ordered map. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("category", category);
        map.put("priority", priority);
        map.putAll(fields);
        return map;
    }
}
