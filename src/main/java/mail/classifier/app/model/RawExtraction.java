package mail.classifier.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Unfiltered extraction output: labels plus optional invoice / request sub-objects.
 * Sub-objects are plain maps so unexpected keys survive until the flattener drops them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawExtraction {
    private String category;
    private String priority;
    private Map<String, Object> invoice;
    private Map<String, Object> request;
}
