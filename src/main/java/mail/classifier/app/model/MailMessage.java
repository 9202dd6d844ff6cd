package mail.classifier.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A fetched mail with its attachment text already flattened upstream.
 * The external id is the idempotency key for the persisted record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MailMessage {
    @JsonProperty("id")
    private String externalId;

    private String subject;

    private String sender;

    @JsonProperty("received_from")
    private String receivedFrom;

    /** ISO-8601, e.g. 2025-08-27T06:50:00Z */
    @JsonProperty("received_at")
    private String receivedAt;

    @JsonProperty("mail_body_text")
    private String bodyText;

    @JsonProperty("mail_body")
    private String body;

    @JsonProperty("body_preview")
    private String bodyPreview;

    @JsonProperty("attachment_text")
    private String attachmentText;

    @Builder.Default
    @JsonProperty("attachments")
    private List<String> attachmentNames = new ArrayList<>();

    @Builder.Default
    @JsonProperty("attachment_methods")
    private List<String> attachmentMethods = new ArrayList<>();

    /**
     * Body with the fallback chain full text, plain body, preview.
     */
    public String resolveBody() {
        if (bodyText != null && !bodyText.isEmpty()) {
            return bodyText;
        }
        if (body != null && !body.isEmpty()) {
            return body;
        }
        return bodyPreview != null ? bodyPreview : "";
    }
}
