package mail.classifier.app.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processed-vs-expected counter for one ingestion batch. Informational only.
 */
@Slf4j
public class BatchProgress {
    private final String batchId;
    private final int total;
    private final AtomicInteger processed = new AtomicInteger();

    public BatchProgress(String batchId, int total) {
        this.batchId = batchId;
        this.total = Math.max(0, total);
        log.info("[PROGRESS] batch={} starting enrichment of {} mails", batchId, this.total);
    }

    /** Count one message that reached a terminal state. Thread-safe. */
    public int markProcessed() {
        int done = processed.incrementAndGet();
        if (total > 0) {
            log.info("[PROGRESS] batch={} processed {}/{} mails", batchId, done, total);
        } else {
            log.info("[PROGRESS] batch={} processed {} mails", batchId, done);
        }
        return done;
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getTotal() {
        return total;
    }

    public String getBatchId() {
        return batchId;
    }

    public boolean isComplete() {
        return total > 0 && processed.get() >= total;
    }
}
