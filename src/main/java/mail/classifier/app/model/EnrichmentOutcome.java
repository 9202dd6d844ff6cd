package mail.classifier.app.model;

/**
 * Terminal state of one enrichment run.
 * SUCCESS: model path result. DEGRADED: heuristic fallback result. FAILED: nothing usable was patched.
 */
public class EnrichmentOutcome {

    public enum Status {
        SUCCESS,
        DEGRADED,
        FAILED
    }

    private final Status status;
    private final EnrichmentResult result;
    private final String reason;

    private EnrichmentOutcome(Status status, EnrichmentResult result, String reason) {
        this.status = status;
        this.result = result;
        this.reason = reason;
    }

    public static EnrichmentOutcome success(EnrichmentResult result) {
        return new EnrichmentOutcome(Status.SUCCESS, result, null);
    }

    public static EnrichmentOutcome degraded(EnrichmentResult result, String reason) {
        return new EnrichmentOutcome(Status.DEGRADED, result, reason);
    }

    public static EnrichmentOutcome failed(String reason) {
        return new EnrichmentOutcome(Status.FAILED, null, reason);
    }

    /** Same outcome, now failed at the store; the computed result is kept for logging. */
    public EnrichmentOutcome patchFailed(String patchReason) {
        return new EnrichmentOutcome(Status.FAILED, result, patchReason);
    }

    public Status getStatus() {
        return status;
    }

    public EnrichmentResult getResult() {
        return result;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "EnrichmentOutcome{status=" + status + ", result=" + result + ", reason=" + reason + "}";
    }
}
