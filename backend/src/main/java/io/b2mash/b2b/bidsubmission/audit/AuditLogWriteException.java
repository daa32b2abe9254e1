package io.b2mash.b2b.bidsubmission.audit;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The audit log could not record an entry. Submission processing must not continue silently. */
public class AuditLogWriteException extends ErrorResponseException {

  public AuditLogWriteException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Audit log unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
