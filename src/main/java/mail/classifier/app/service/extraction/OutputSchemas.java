package mail.classifier.app.service.extraction;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import mail.classifier.app.model.Category;
import mail.classifier.app.model.Priority;

import java.util.List;

/**
 * JSON schemas sent to the backend in schema-constrained mode.
 */
final class OutputSchemas {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final List<String> INVOICE_KEYS = List.of(
            "invoice_number", "invoice_date", "due_date", "invoice_amount", "payment_link",
            "bsb", "account_number", "account_name", "biller_code", "payment_reference", "description");

    private OutputSchemas() {
    }

    static ObjectNode classification() {
        ObjectNode schema = object();
        ObjectNode properties = schema.putObject("properties");
        ArrayNode categories = properties.putObject("category").put("type", "string").putArray("enum");
        for (Category category : Category.values()) {
            categories.add(category.getLabel());
        }
        ArrayNode priorities = properties.putObject("priority").put("type", "string").putArray("enum");
        for (Priority priority : Priority.values()) {
            priorities.add(priority.getLabel());
        }
        schema.putArray("required").add("category").add("priority");
        return schema;
    }

    static ObjectNode invoice() {
        ObjectNode schema = object();
        ObjectNode properties = schema.putObject("properties");
        for (String key : INVOICE_KEYS) {
            properties.putObject(key).putArray("type").add("string").add("null");
        }
        return schema;
    }

    static ObjectNode requestSummary() {
        ObjectNode schema = object();
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("summary").put("type", "string");
        properties.putObject("ticket_number").putArray("type").add("string").add("null");
        schema.putArray("required").add("summary");
        return schema;
    }

    private static ObjectNode object() {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        return schema;
    }
}
