package io.invoicedesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A concurrent writer won a race detected by the store (counter version, row lock timeout or the
 * unique invoice number constraint). Safe to retry from scratch.
 */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String code, String title, String detail) {
    this(code, title, detail, null);
  }

  public ResourceConflictException(String code, String title, String detail, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(code, title, detail), cause);
  }

  private static ProblemDetail createProblem(String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.CONFLICT);
    problem.setProperty(ErrorKind.CODE_PROPERTY, code);
    return problem;
  }
}
