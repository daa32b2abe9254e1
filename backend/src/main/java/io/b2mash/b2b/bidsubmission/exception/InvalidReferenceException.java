package io.b2mash.b2b.bidsubmission.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A submission request names an RFP or portal that this deployment does not know about. */
public class InvalidReferenceException extends ErrorResponseException {

  public InvalidReferenceException(String referenceType, Object id) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem(
            "Unknown " + referenceType.toLowerCase(),
            "No " + referenceType.toLowerCase() + " registered with id " + id),
        null);
  }

  public static InvalidReferenceException withDetail(String title, String detail) {
    return new InvalidReferenceException(title, detail, HttpStatus.BAD_REQUEST);
  }

  private InvalidReferenceException(String title, String detail, HttpStatus status) {
    super(status, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
