package io.invoicedesk.backend.multitenancy;

import io.invoicedesk.backend.exception.MissingTenantContextException;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Holds the current company id (the tenant) for the executing thread. Bound by {@link
 * TenantFilter} for HTTP requests, by {@link TenantContextTaskDecorator} for worker threads and by
 * {@link #callAs} for programmatic callers.
 */
public final class TenantContext {

  private static final ThreadLocal<UUID> CURRENT_COMPANY = new ThreadLocal<>();

  private TenantContext() {}

  public static void setCompanyId(UUID companyId) {
    CURRENT_COMPANY.set(companyId);
  }

  /** Returns the current company id, or null if not bound. */
  public static UUID getCompanyId() {
    return CURRENT_COMPANY.get();
  }

  /** Returns the current company id. Throws if not bound. */
  public static UUID requireCompanyId() {
    UUID companyId = CURRENT_COMPANY.get();
    if (companyId == null) {
      throw new MissingTenantContextException();
    }
    return companyId;
  }

  public static void clear() {
    CURRENT_COMPANY.remove();
  }

  /**
   * Runs the callable with the given company bound, restoring the previous binding afterwards.
   */
  public static <T> T callAs(UUID companyId, Callable<T> callable) throws Exception {
    UUID previous = CURRENT_COMPANY.get();
    CURRENT_COMPANY.set(companyId);
    try {
      return callable.call();
    } finally {
      restore(previous);
    }
  }

  /** Unchecked variant of {@link #callAs} for runnables. */
  public static void runAs(UUID companyId, Runnable runnable) {
    UUID previous = CURRENT_COMPANY.get();
    CURRENT_COMPANY.set(companyId);
    try {
      runnable.run();
    } finally {
      restore(previous);
    }
  }

  private static void restore(UUID previous) {
    if (previous == null) {
      CURRENT_COMPANY.remove();
    } else {
      CURRENT_COMPANY.set(previous);
    }
  }
}
