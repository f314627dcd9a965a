package io.invoicedesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String code, String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(code, title, detail), null);
  }

  private static ProblemDetail createProblem(String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.INVALID_STATE);
    problem.setProperty(ErrorKind.CODE_PROPERTY, code);
    return problem;
  }
}
