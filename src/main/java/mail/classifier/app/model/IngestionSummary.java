package mail.classifier.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one ingestion pass did. Returned before enrichment finishes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionSummary {
    private boolean ok;
    private int fetched;

    @JsonProperty("phase1_created_or_skipped")
    private int createdOrSkipped;

    @JsonProperty("phase2_queued_enrichment")
    private int queued;

    /** Null entries plus mails whose Phase-1 create failed. */
    private int failed;

    @Builder.Default
    private List<MailDetail> details = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MailDetail {
        @JsonProperty("id")
        private String externalId;
        private String subject;
        @JsonProperty("body_text")
        private TextPreview bodyText;
        @JsonProperty("attachment_text")
        private TextPreview attachmentText;
        @JsonProperty("attachments_count")
        private int attachmentsCount;
        @JsonProperty("attachment_methods")
        private List<String> attachmentMethods;
        @JsonProperty("created_or_skipped")
        private boolean createdOrSkipped;
        @JsonProperty("store_create_ms")
        private long storeCreateMs;
    }

    /** Length plus a short prefix; full text never leaves the service. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TextPreview {
        private int len;
        private String preview;

        public static TextPreview of(String text, int limit) {
            if (text == null || text.isBlank()) {
                return new TextPreview(0, "");
            }
            String trimmed = text.strip();
            if (trimmed.length() <= limit) {
                return new TextPreview(trimmed.length(), trimmed);
            }
            return new TextPreview(trimmed.length(), trimmed.substring(0, limit) + "…");
        }
    }
}
