package mail.classifier.app.service;

import mail.classifier.app.model.Category;
import mail.classifier.app.model.EnrichmentResult;
import mail.classifier.app.model.RawExtraction;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects a raw extraction onto the exact field set persisted for its category.
 *
 * <ul>
 *   <li>Invoice: category, priority and the eleven invoice fields (null when absent)</li>
 *   <li>Customer Requests: category, priority, summary, ticket_number</li>
 *   <li>General, Misc and unrecognised labels: category and priority only</li>
 * </ul>
 * Anything else the backend returned is dropped here.
 */
@Component
public class EnrichmentFlattener {

    static final List<String> INVOICE_KEYS = List.of(
            "invoice_number", "invoice_date", "due_date", "invoice_amount", "payment_link",
            "bsb", "account_number", "account_name", "biller_code", "payment_reference", "description");

    public EnrichmentResult flatten(RawExtraction raw) {
        String category = raw.getCategory() == null ? "" : raw.getCategory().strip();
        String priority = raw.getPriority() == null ? "" : raw.getPriority().strip();
        if (category.equalsIgnoreCase("invoices")) {
            category = Category.INVOICE.getLabel();
        }

        Optional<Category> resolved = Category.fromLabel(category);
        if (resolved.isEmpty()) {
            return EnrichmentResult.labelsOnly(category, priority);
        }

        Map<String, String> fields;
        switch (resolved.get()) {
            case INVOICE:
                fields = invoiceFields(raw.getInvoice());
                break;
            case CUSTOMER_REQUESTS:
                fields = requestFields(raw.getRequest());
                break;
            case GENERAL:
            case MISC:
            default:
                fields = Map.of();
                break;
        }
        return new EnrichmentResult(category, priority, fields);
    }

    private static Map<String, String> invoiceFields(Map<String, Object> invoice) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (String key : INVOICE_KEYS) {
            fields.put(key, invoice == null ? null : text(invoice.get(key)));
        }
        return fields;
    }

    private static Map<String, String> requestFields(Map<String, Object> request) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (request == null) {
            fields.put("summary", null);
            fields.put("ticket_number", null);
            return fields;
        }
        fields.put("summary", firstPresent(request, "summary", "overview"));
        fields.put("ticket_number", firstPresent(request, "ticket_number", "request_number"));
        return fields;
    }

    private static String firstPresent(Map<String, Object> source, String key, String alternative) {
        String value = text(source.get(key));
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return text(source.get(alternative));
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
