package mail.classifier.app.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import mail.classifier.app.model.Category;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Classification and enrichment settings. Documented in application.properties.
 */
@ConfigurationProperties(prefix = "mail.classifier")
@NoArgsConstructor
@Getter
@Setter
public class MailClassifierProperties {

    /** Enrichment pool size. Default 4. */
    private int workers = 4;

    /** Queued enrichments beyond the pool size. Default 500. */
    private int queueCapacity = 500;

    /** Phase-1 store calls slower than this are logged as warnings. */
    private long slowStoreMs = 3000;

    /** Characters of body/attachment text echoed in ingestion summaries. */
    private int previewChars = 280;

    private String ticketPrefix = "REQ-";

    private List<String> urgencyWords = new ArrayList<>(List.of(
            "urgent", "asap", "immediate", "important", "high priority"));

    /** Ordered keyword table for the heuristic classifier. First match wins. */
    private List<KeywordRule> rules = defaultRules();

    private Model model = new Model();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class KeywordRule {
        private Category category;
        private List<String> keywords = new ArrayList<>();

        public KeywordRule(Category category, List<String> keywords) {
            this.category = category;
            this.keywords = new ArrayList<>(keywords);
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Model {
        /** ollama or openai. */
        private String provider = "ollama";
        private String baseUrl = "http://localhost:11434";
        private String apiKey = "";
        private String classifierModel = "mail-classifier-small";
        private String invoiceModel = "invoice-extractor-small";
        private String requestModel = "request-summarizer-small";
        private double temperature = 0.0;
        private int numPredict = 200;
        private int invoiceNumPredict = 400;
        private int numCtx = 3072;
        private String keepAlive = "30m";
        /** Read timeout for one generation call; a timeout triggers the heuristic fallback. */
        private Duration timeout = Duration.ofSeconds(120);
        private int classifyMaxChars = 4000;
        private int extractMaxChars = 12000;
    }

    static List<KeywordRule> defaultRules() {
        List<KeywordRule> rules = new ArrayList<>();
        rules.add(new KeywordRule(Category.INVOICE, List.of("invoice", "bill", "statement")));
        rules.add(new KeywordRule(Category.CUSTOMER_REQUESTS, List.of("issue", "support", "ticket")));
        rules.add(new KeywordRule(Category.CUSTOMER_REQUESTS, List.of("access", "permission", "request")));
        rules.add(new KeywordRule(Category.CUSTOMER_REQUESTS, List.of("client", "customer", "enquiry", "inquiry")));
        rules.add(new KeywordRule(Category.MISC, List.of("meeting", "calendar", "invite")));
        rules.add(new KeywordRule(Category.MISC, List.of("timesheet", "approval", "work hours")));
        return rules;
    }
}
