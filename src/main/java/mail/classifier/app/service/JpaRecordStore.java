package mail.classifier.app.service;

import lombok.extern.slf4j.Slf4j;
import mail.classifier.app.entity.MailRecord;
import mail.classifier.app.model.Category;
import mail.classifier.app.model.EnrichmentResult;
import mail.classifier.app.model.MailMessage;
import mail.classifier.app.repository.MailRecordRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

/**
 * {@link RecordStore} on the relational database.
 *
 * Patch rules per category:
 *  - Invoice: paid reset to false, every invoice key present in the result written (nulls included)
 *  - Customer Requests: summary to request overview, ticket_number to request number
 *  - anything else: category and priority only
 */
@Slf4j
@Service
public class JpaRecordStore implements RecordStore {
    private final MailRecordRepository mailRecordRepository;

    public JpaRecordStore(MailRecordRepository mailRecordRepository) {
        this.mailRecordRepository = mailRecordRepository;
    }

    @Override
    public Optional<MailRecord> lookupRecord(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return Optional.empty();
        }
        return mailRecordRepository.findByExternalId(externalId);
    }

    @Override
    public boolean createRecord(MailMessage mail) {
        if (mail == null || mail.getExternalId() == null || mail.getExternalId().isBlank()) {
            log.warn("Record create skipped: mail or external id missing");
            return false;
        }
        String externalId = mail.getExternalId();

        if (lookupRecord(externalId).isPresent()) {
            log.info("Record exists, create skipped for externalId={}", externalId);
            return true;
        }

        MailRecord record = new MailRecord();
        record.setExternalId(externalId);
        record.setSender(mail.getSender());
        record.setReceivedFrom(mail.getReceivedFrom());
        record.setReceivedAt(mail.getReceivedAt());
        record.setSubject(mail.getSubject());
        record.setEmailBody(mail.resolveBody());
        record.setAttachments(mail.getAttachmentNames() == null ? "" : String.join(", ", mail.getAttachmentNames()));
        record.setAttachmentContent(mail.getAttachmentText() == null ? "" : mail.getAttachmentText());

        try {
            mailRecordRepository.saveAndFlush(record);
            log.info("Record created for externalId={}", externalId);
            return true;
        } catch (DataIntegrityViolationException e) {
            // either a concurrent insert of the same id or a constraint this row itself violates
            if (lookupRecord(externalId).isPresent()) {
                log.info("Record for externalId={} created concurrently, treating as existing", externalId);
                return true;
            }
            log.error("Record create rejected for externalId={}: {}", externalId, e.getMostSpecificCause().getMessage(), e);
            return false;
        } catch (Exception e) {
            log.error("Record create failed for externalId={}: {}", externalId, e.getMessage(), e);
            return false;
        }
    }

    @Override
    @Transactional
    public boolean patchRecord(String externalId, EnrichmentResult enrichment) {
        if (externalId == null || externalId.isBlank()) {
            log.warn("Record patch skipped: missing external id");
            return false;
        }
        Optional<MailRecord> existing = lookupRecord(externalId);
        if (existing.isEmpty()) {
            log.warn("Record patch skipped: no record for externalId={}", externalId);
            return false;
        }
        MailRecord record = existing.get();

        String category = enrichment.getCategory() == null ? "" : enrichment.getCategory().strip();
        if (category.equalsIgnoreCase("invoices")) {
            category = Category.INVOICE.getLabel();
        }
        if (!category.isEmpty()) {
            record.setCategory(category);
        }
        if (enrichment.getPriority() != null) {
            record.setPriority(enrichment.getPriority());
        }

        Map<String, String> fields = enrichment.getFields();
        Optional<Category> resolved = Category.fromLabel(category);
        if (resolved.isPresent()) {
            switch (resolved.get()) {
                case INVOICE:
                    applyInvoice(record, fields);
                    break;
                case CUSTOMER_REQUESTS:
                    applyRequest(record, fields);
                    break;
                case GENERAL:
                case MISC:
                default:
                    // labels only
                    break;
            }
        }

        mailRecordRepository.save(record);
        log.info("Record patched for externalId={} fields={}", externalId, fields.keySet());
        return true;
    }

    private static void applyInvoice(MailRecord record, Map<String, String> fields) {
        record.setPaid(false);
        if (fields.containsKey("invoice_number")) record.setInvoiceNumber(fields.get("invoice_number"));
        if (fields.containsKey("invoice_date")) record.setInvoiceDate(fields.get("invoice_date"));
        if (fields.containsKey("due_date")) record.setDueDate(fields.get("due_date"));
        if (fields.containsKey("invoice_amount")) record.setInvoiceAmount(fields.get("invoice_amount"));
        if (fields.containsKey("payment_link")) record.setPaymentLink(fields.get("payment_link"));
        if (fields.containsKey("bsb")) record.setBsb(fields.get("bsb"));
        if (fields.containsKey("account_number")) record.setAccountNumber(fields.get("account_number"));
        if (fields.containsKey("account_name")) record.setAccountName(fields.get("account_name"));
        if (fields.containsKey("biller_code")) record.setBillerCode(fields.get("biller_code"));
        if (fields.containsKey("payment_reference")) record.setPaymentReference(fields.get("payment_reference"));
        if (fields.containsKey("description")) record.setInvoiceDescription(fields.get("description"));
    }

    private static void applyRequest(MailRecord record, Map<String, String> fields) {
        if (fields.containsKey("summary")) record.setRequestOverview(fields.get("summary"));
        if (fields.containsKey("ticket_number")) record.setRequestNumber(fields.get("ticket_number"));
    }
}
