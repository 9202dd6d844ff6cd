package mail.classifier.app.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text shaping helpers for prompts.
 */
public final class ExtractionText {

    private ExtractionText() {
    }

    /** Stripped and cut to {@code maxChars}; empty for null. */
    public static String trim(String text, int maxChars) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = text.strip();
        return stripped.length() <= maxChars ? stripped : stripped.substring(0, maxChars);
    }

    public static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return value == null ? "" : value.strip();
        }
        String[] words = value.strip().split("\\s+");
        List<String> out = new ArrayList<>(words.length);
        for (String word : words) {
            out.add(word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT));
        }
        return String.join(" ", out);
    }

    /**
     * Subject, body and numbered attachment sections joined by blank lines.
     */
    public static String composeEmailText(String subject, String body, List<String> attachments) {
        List<String> parts = new ArrayList<>();
        if (subject != null && !subject.isBlank()) {
            parts.add("Subject: " + subject.strip());
        }
        parts.add("Email Body:");
        parts.add(body == null ? "" : body.strip());
        if (attachments != null && !attachments.isEmpty()) {
            parts.add("\nAttachments:");
            int index = 1;
            for (String attachment : attachments) {
                String snippet = attachment == null ? "" : attachment.strip();
                if (!snippet.isEmpty()) {
                    parts.add("--- Attachment " + index + " ---\n" + snippet);
                }
                index++;
            }
        }
        return String.join("\n\n", parts);
    }
}
