package io.b2mash.b2b.bidsubmission.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when an operator asks to retry a submission that has used up its retry budget. */
public class RetryExhaustedException extends ErrorResponseException {

  public RetryExhaustedException(String jobId, int attempts, int maxRetries) {
    super(
        HttpStatus.CONFLICT,
        createProblem(
            "Retry budget exhausted",
            "Submission "
                + jobId
                + " has made "
                + attempts
                + " attempt(s) against a limit of "
                + maxRetries),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
