package io.invoicedesk.backend.multitenancy;

import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/**
 * Carries the submitting thread's company id and MDC entries over to the worker thread that runs
 * the task, and clears both when the task finishes.
 */
public class TenantContextTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    UUID companyId = TenantContext.getCompanyId();
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    return () -> {
      if (mdc != null) {
        MDC.setContextMap(mdc);
      }
      try {
        if (companyId != null) {
          TenantContext.runAs(companyId, runnable);
        } else {
          runnable.run();
        }
      } finally {
        MDC.clear();
      }
    };
  }
}
