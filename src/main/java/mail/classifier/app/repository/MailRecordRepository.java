package mail.classifier.app.repository;

import mail.classifier.app.entity.MailRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MailRecordRepository extends JpaRepository<MailRecord, String> {
    Optional<MailRecord> findByExternalId(String externalId);
    long countByExternalId(String externalId);
}
