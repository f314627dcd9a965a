package io.invoicedesk.backend.signing;

import io.invoicedesk.backend.exception.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Signing failed for a reason other than the operator cancelling: unusable key material, an
 * unsupported key algorithm, or a cryptographic or PDF error. Nothing is stored in that case.
 */
public class SigningException extends ErrorResponseException {

  public SigningException(String code, String detail) {
    this(code, detail, null);
  }

  public SigningException(String code, String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(code, detail), cause);
  }

  private static ProblemDetail createProblem(String code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Signing failed");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.SIGNING_ERROR);
    problem.setProperty(ErrorKind.CODE_PROPERTY, code);
    return problem;
  }
}
