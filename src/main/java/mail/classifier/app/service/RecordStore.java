package mail.classifier.app.service;

import mail.classifier.app.entity.MailRecord;
import mail.classifier.app.model.EnrichmentResult;
import mail.classifier.app.model.MailMessage;

import java.util.Optional;

/**
 * Persistence of mail records, keyed by external message id.
 * Create and patch are both safe to re-run for the same id.
 */
public interface RecordStore {

    Optional<MailRecord> lookupRecord(String externalId);

    /**
     * Insert the minimal Phase-1 fields once.
     * @return true when the record was created or already existed
     */
    boolean createRecord(MailMessage mail);

    /**
     * Apply an enrichment result to an existing record. Keys absent from the result are left as they are.
     * @return false when the record does not exist or the write failed
     */
    boolean patchRecord(String externalId, EnrichmentResult enrichment);
}
