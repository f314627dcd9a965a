package io.invoicedesk.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The caller cancelled the operation, or the operator aborted an interactive step such as key
 * selection. Never retried automatically.
 */
public class OperationCancelledException extends ErrorResponseException {

  public OperationCancelledException(String code, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(code, detail), null);
  }

  private static ProblemDetail createProblem(String code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Operation cancelled");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.CANCELLED);
    problem.setProperty(ErrorKind.CODE_PROPERTY, code);
    return problem;
  }
}
