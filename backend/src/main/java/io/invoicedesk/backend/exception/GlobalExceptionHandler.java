package io.invoicedesk.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps store-level concurrency failures that escape the services to a 409 with kind CONFLICT.
 * Domain exceptions carry their own {@link ProblemDetail} and need no handler here.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ConcurrencyFailureException.class)
  public ResponseEntity<ProblemDetail> handleConcurrencyFailure(
      ConcurrencyFailureException ex, HttpServletRequest request) {
    log.warn("Concurrent modification on {}: {}", request.getRequestURI(), ex.getMessage());
    return conflict("store.concurrent_modification", "Resource was modified concurrently.");
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrityViolation(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    log.warn("Constraint violation on {}: {}", request.getRequestURI(), ex.getMessage());
    return conflict("store.constraint_violation", "A concurrent change violated a constraint.");
  }

  private static ResponseEntity<ProblemDetail> conflict(String code, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail(detail + " Please retry.");
    problem.setProperty(ErrorKind.PROPERTY, ErrorKind.CONFLICT);
    problem.setProperty(ErrorKind.CODE_PROPERTY, code);
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
