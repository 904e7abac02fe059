package io.volunteerhub.emails.context;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A reference stored in a context no longer resolves: the entity is gone, no resolver handles its
 * kind, or the requested property is absent.
 */
public class DanglingReferenceException extends ErrorResponseException {

  private final String uri;

  public DanglingReferenceException(String uri, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(uri, detail), null);
    this.uri = uri;
  }

  public String getUri() {
    return uri;
  }

  private static ProblemDetail createProblem(String uri, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Dangling reference");
    problem.setDetail(detail);
    problem.setProperty("uri", uri);
    return problem;
  }
}
