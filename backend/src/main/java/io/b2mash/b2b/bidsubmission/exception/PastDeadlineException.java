package io.b2mash.b2b.bidsubmission.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PastDeadlineException extends ErrorResponseException {

  public PastDeadlineException(String rfpId, Instant deadline) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Response deadline has passed",
            "RFP " + rfpId + " closed for responses at " + deadline),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
