package io.invoicedesk.backend.exception;

import org.springframework.web.ErrorResponseException;

/**
 * Machine-readable failure category carried in every problem response as the {@code kind}
 * property. Callers map kinds to user-facing messages; only {@link #CONFLICT} is safe to retry.
 */
public enum ErrorKind {
  NOT_FOUND,
  INVALID_STATE,
  CONFLICT,
  CANCELLED,
  RENDER_ERROR,
  SIGNING_ERROR;

  public static final String PROPERTY = "kind";
  public static final String CODE_PROPERTY = "code";

  public boolean isRetryable() {
    return this == CONFLICT;
  }

  /** Returns the kind stamped on the given exception, or null if it carries none. */
  public static ErrorKind of(Throwable throwable) {
    if (throwable instanceof ErrorResponseException ere && ere.getBody().getProperties() != null) {
      Object kind = ere.getBody().getProperties().get(PROPERTY);
      if (kind instanceof ErrorKind errorKind) {
        return errorKind;
      }
    }
    return null;
  }
}
