package io.b2mash.b2b.bidsubmission.submission;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The job store could not persist a submission's state. */
public class SubmissionStoreException extends ErrorResponseException {

  public SubmissionStoreException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Submission store unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
