package mail.classifier.app.service;

import mail.classifier.app.config.MailClassifierProperties;
import mail.classifier.app.config.MailClassifierProperties.KeywordRule;
import mail.classifier.app.model.Category;
import mail.classifier.app.model.Classification;
import mail.classifier.app.model.MailMessage;
import mail.classifier.app.model.Priority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classifier used as the soft pre-check and as the fallback of last resort.
 * No I/O, no exceptions. Priority is only ever High or Low here.
 */
@Component
public class HeuristicClassifier {
    private final List<String> urgencyWords;
    private final List<KeywordRule> rules;

    public HeuristicClassifier(MailClassifierProperties properties) {
        this.urgencyWords = List.copyOf(properties.getUrgencyWords());
        this.rules = List.copyOf(properties.getRules());
    }

    public Classification classify(MailMessage mail) {
        if (mail == null) {
            return classify("");
        }
        String preview = mail.getBodyPreview() != null ? mail.getBodyPreview() : mail.resolveBody();
        String names = mail.getAttachmentNames() == null ? "" : String.join(" ", mail.getAttachmentNames());
        return classify(nullToEmpty(mail.getSubject()) + " " + nullToEmpty(preview) + " " + names);
    }

    public Classification classify(String text) {
        String haystack = nullToEmpty(text).toLowerCase(Locale.ROOT);

        Priority priority = Priority.LOW;
        for (String word : urgencyWords) {
            if (haystack.contains(word.toLowerCase(Locale.ROOT))) {
                priority = Priority.HIGH;
                break;
            }
        }

        for (KeywordRule rule : rules) {
            if (rule.getCategory() == null || rule.getKeywords() == null) {
                continue;
            }
            for (String keyword : rule.getKeywords()) {
                if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return new Classification(rule.getCategory(), priority);
                }
            }
        }
        return new Classification(Category.GENERAL, priority);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
