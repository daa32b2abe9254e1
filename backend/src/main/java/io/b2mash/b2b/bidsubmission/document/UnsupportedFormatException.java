package io.b2mash.b2b.bidsubmission.document;

import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class UnsupportedFormatException extends ErrorResponseException {

  public UnsupportedFormatException(DocumentFormat format, Set<DocumentFormat> supported) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(
            "Unsupported document format",
            "No renderer available for " + format + "; supported formats are " + supported),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
