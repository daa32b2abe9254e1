package io.b2mash.b2b.bidsubmission.submission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SubmissionJobRecordRepository extends JpaRepository<SubmissionJobRecord, String> {}
