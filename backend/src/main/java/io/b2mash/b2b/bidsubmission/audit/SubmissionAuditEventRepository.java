package io.b2mash.b2b.bidsubmission.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubmissionAuditEventRepository extends JpaRepository<SubmissionAuditEvent, UUID> {

  List<SubmissionAuditEvent> findByJobIdOrderBySequenceAsc(String jobId);
}
