package mail.classifier.app.entity;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "mail_records", uniqueConstraints = @UniqueConstraint(columnNames = "external_id"))
@Data
public class MailRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    // Phase 1
    private String sender;
    private String receivedFrom;
    private String receivedAt;
    @Column(length = 1000)
    private String subject;
    @Column(columnDefinition = "TEXT")
    private String emailBody;
    @Column(length = 2000)
    private String attachments;
    @Column(columnDefinition = "TEXT")
    private String attachmentContent;

    // Phase 2, free-form model and regex output
    @Column(columnDefinition = "TEXT")
    private String category;
    @Column(columnDefinition = "TEXT")
    private String priority;
    private Boolean paid;

    @Column(columnDefinition = "TEXT")
    private String invoiceNumber;
    @Column(columnDefinition = "TEXT")
    private String invoiceDate;
    @Column(columnDefinition = "TEXT")
    private String dueDate;
    @Column(columnDefinition = "TEXT")
    private String invoiceAmount;
    @Column(columnDefinition = "TEXT")
    private String paymentLink;
    @Column(columnDefinition = "TEXT")
    private String bsb;
    @Column(columnDefinition = "TEXT")
    private String accountNumber;
    @Column(columnDefinition = "TEXT")
    private String accountName;
    @Column(columnDefinition = "TEXT")
    private String billerCode;
    @Column(columnDefinition = "TEXT")
    private String paymentReference;
    @Column(columnDefinition = "TEXT")
    private String invoiceDescription;

    @Column(columnDefinition = "TEXT")
    private String requestOverview;
    @Column(columnDefinition = "TEXT")
    private String requestNumber;
}
