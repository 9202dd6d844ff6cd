package mail.classifier.app.service.extraction;

import mail.classifier.app.model.InvoiceFields;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based invoice field harvesting. Patterns are loose; results only fill
 * gaps left by the model. Description is never filled here.
 */
@Component
public class InvoiceRegexFallback {

    private static final String DATE =
            "(\\d{1,2}[/.\\-]\\d{1,2}[/.\\-]\\d{2,4}"
            + "|\\d{4}-\\d{2}-\\d{2}"
            + "|\\d{1,2}\\s+[A-Za-z]{3,9}\\.?\\s+\\d{4}"
            + "|[A-Za-z]{3,9}\\.?\\s+\\d{1,2},?\\s+\\d{4})";

    private static final Pattern INVOICE_NUMBER = Pattern.compile(
            "(?i)\\binv(?:oice|o1ce)?\\s*(?:no\\.?|number|num|#)?\\s*[:#]?\\s*"
            + "([A-Z0-9][A-Z0-9\\-\u2014/]*\\d[A-Z0-9\\-\u2014/]*)");

    private static final Pattern INVOICE_DATE = Pattern.compile(
            "(?i)\\b(?:invoice|issue|tax\\s+invoice)\\s*date\\s*[:\\-]?\\s*" + DATE);

    private static final Pattern DUE_DATE = Pattern.compile(
            "(?i)\\b(?:due\\s*date|payment\\s+due|due\\s+by|due\\s+on)\\s*[:\\-]?\\s*" + DATE);

    // (?i:...) only on the label so the currency code stays upper-case
    private static final Pattern TOTAL = Pattern.compile(
            "\\b(?i:total(?:\\s+due)?|amount\\s+due|balance\\s+due)"
            + "[ \\t]*(?:\\(?[ \\t]*([A-Z]{3})[ \\t]*\\)?)?[ \\t]*[:\\-]?[ \\t]*"
            + "([A-Z]{3})?[ \\t]*([$\u20ac\u00a3])?[ \\t]*(\\d[\\d,]*(?:\\.\\d{1,2})?)");

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"')]+");

    private static final Pattern BSB = Pattern.compile(
            "(?i)\\bB[ \\t]*S[ \\t]*B\\b[ \\t]*[:\\-]?[ \\t]*(\\d(?:[ \\t\\-]?\\d){5})(?!\\d)");

    private static final Pattern ACCOUNT_NUMBER = Pattern.compile(
            "(?i)\\b(?:account|acct|acc|a/c)[ \\t]*(?:number|no\\.?|num|#)?[ \\t]*[:\\-]?[ \\t]*(\\d[\\d \\-]{3,}\\d)");

    private static final Pattern ACCOUNT_NAME = Pattern.compile(
            "(?im)^[ \\t]*(?:account|acct|acc|a/c)[ \\t]*name[ \\t]*[:\\-][ \\t]*(.+?)[ \\t]*$");

    private static final Pattern BILLER_CODE = Pattern.compile(
            "(?i)\\bbiller[ \\t]*code[ \\t]*[:\\-]?[ \\t]*(\\d{3,10})\\b");

    private static final Pattern PAYMENT_REFERENCE = Pattern.compile(
            "(?im)^[ \\t]*(?:payment[ \\t]+reference|customer[ \\t]+reference|reference|ref|crn)\\.?"
            + "[ \\t]*(?:no\\.?|number)?[ \\t]*[:\\-][ \\t]*([A-Za-z0-9][A-Za-z0-9\\-/]*)");

    public InvoiceFields parse(String text) {
        if (text == null || text.isBlank()) {
            return new InvoiceFields();
        }
        return InvoiceFields.builder()
                .invoiceNumber(first(INVOICE_NUMBER, text))
                .invoiceDate(first(INVOICE_DATE, text))
                .dueDate(first(DUE_DATE, text))
                .invoiceAmount(total(text))
                .paymentLink(firstUrl(text))
                .bsb(bsb(text))
                .accountNumber(accountNumber(text))
                .accountName(first(ACCOUNT_NAME, text))
                .billerCode(first(BILLER_CODE, text))
                .paymentReference(first(PAYMENT_REFERENCE, text))
                .build();
    }

    private static String first(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (m.find()) {
            String value = m.group(1).strip();
            return value.isEmpty() ? null : value;
        }
        return null;
    }

    /** Last total wins: grand totals come after line items and body quotes. */
    private static String total(String text) {
        Matcher m = TOTAL.matcher(text);
        String found = null;
        while (m.find()) {
            String currency = m.group(1) != null ? m.group(1) : m.group(2);
            String symbol = m.group(3) != null ? m.group(3) : "";
            String amount = symbol + m.group(4);
            found = currency != null ? currency + " " + amount : amount;
        }
        return found;
    }

    private static String firstUrl(String text) {
        Matcher m = URL.matcher(text);
        if (m.find()) {
            return m.group().replaceAll("[.,;:]+$", "");
        }
        return null;
    }

    private static String bsb(String text) {
        Matcher m = BSB.matcher(text);
        if (m.find()) {
            String digits = m.group(1).replaceAll("\\D", "");
            return digits.substring(0, 3) + "-" + digits.substring(3);
        }
        return null;
    }

    private static String accountNumber(String text) {
        Matcher m = ACCOUNT_NUMBER.matcher(text);
        if (m.find()) {
            return m.group(1).replaceAll("[ \\-]", "");
        }
        return null;
    }
}
