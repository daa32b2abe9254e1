package io.b2mash.b2b.bidsubmission.packaging;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PackageAssemblyException extends ErrorResponseException {

  public PackageAssemblyException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Package assembly failed");
    problem.setDetail(detail);
    return problem;
  }
}
