package io.volunteerhub.emails.context;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A stored context value or recipient link is not a well-formed reference or scalar. */
public class InvalidContextUriException extends ErrorResponseException {

  public InvalidContextUriException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invalid context value");
    problem.setDetail(detail);
    return problem;
  }
}
