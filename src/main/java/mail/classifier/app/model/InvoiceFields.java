package mail.classifier.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured invoice data. Every field is independently nullable.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class InvoiceFields {
    private String invoiceNumber;
    private String invoiceDate;
    private String dueDate;
    private String invoiceAmount;
    private String paymentLink;
    private String bsb;
    private String accountNumber;
    private String accountName;
    private String billerCode;
    private String paymentReference;
    private String description;

    /** Snake-case view in declaration order, nulls included. */
    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("invoice_number", invoiceNumber);
        map.put("invoice_date", invoiceDate);
        map.put("due_date", dueDate);
        map.put("invoice_amount", invoiceAmount);
        map.put("payment_link", paymentLink);
        map.put("bsb", bsb);
        map.put("account_number", accountNumber);
        map.put("account_name", accountName);
        map.put("biller_code", billerCode);
        map.put("payment_reference", paymentReference);
        map.put("description", description);
        return map;
    }

    public int populatedCount() {
        int count = 0;
        for (String value : toMap().values()) {
            if (value != null && !value.isBlank()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Copies values from {@code other} into fields that are still empty here.
     * Populated fields are never overwritten.
     */
    public InvoiceFields fillMissingFrom(InvoiceFields other) {
        if (other == null) {
            return this;
        }
        return toBuilder()
                .invoiceNumber(pick(invoiceNumber, other.invoiceNumber))
                .invoiceDate(pick(invoiceDate, other.invoiceDate))
                .dueDate(pick(dueDate, other.dueDate))
                .invoiceAmount(pick(invoiceAmount, other.invoiceAmount))
                .paymentLink(pick(paymentLink, other.paymentLink))
                .bsb(pick(bsb, other.bsb))
                .accountNumber(pick(accountNumber, other.accountNumber))
                .accountName(pick(accountName, other.accountName))
                .billerCode(pick(billerCode, other.billerCode))
                .paymentReference(pick(paymentReference, other.paymentReference))
                .description(pick(description, other.description))
                .build();
    }

    private static String pick(String current, String candidate) {
        if (current != null && !current.isBlank()) {
            return current;
        }
        return candidate != null && !candidate.isBlank() ? candidate : current;
    }
}
