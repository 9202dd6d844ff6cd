package mail.classifier.app.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input to one classification + extraction run. Only {@code bodyText} is required.
 */
@Value
@Builder
public class ExtractionRequest {
    String externalId;
    String subject;
    String bodyText;
    List<String> attachmentsText;
    /** ISO-8601, used for the ticket date */
    String receivedAt;
}
