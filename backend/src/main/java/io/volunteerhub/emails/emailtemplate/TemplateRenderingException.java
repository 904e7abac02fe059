package io.volunteerhub.emails.emailtemplate;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An email template could not be rendered against the resolved context. */
public class TemplateRenderingException extends ErrorResponseException {

  public TemplateRenderingException(String detail, Throwable cause) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Email rendering failed");
    problem.setDetail(detail);
    return problem;
  }
}
