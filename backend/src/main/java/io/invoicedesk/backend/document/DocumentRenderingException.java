package io.invoicedesk.backend.document;

import io.invoicedesk.backend.exception.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when the invoice document cannot be rendered. Nothing is stored in that case. */
public class DocumentRenderingException extends ErrorResponseException {

  public DocumentRenderingException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Document rendering failed");
    problem.setDetail(detail);
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.RENDER_ERROR);
    problem.setProperty(ErrorKind.CODE_PROPERTY, "document.render_failed");
    return problem;
  }
}
