package io.invoicedesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class MissingTenantContextException extends ErrorResponseException {

  public MissingTenantContextException() {
    super(HttpStatus.BAD_REQUEST, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing company context");
    problem.setDetail("Request does not carry a company id (X-Company-Id header)");
    problem.setProperty(ErrorKind.CODE_PROPERTY, "tenant.missing");
    return problem;
  }
}
