package io.invoicedesk.backend.config;

import io.invoicedesk.backend.multitenancy.TenantContextTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for invoice work. Signing gets its own pool so key selection and cryptography never
 * block issuance or rendering, and never run on a request thread.
 */
@Configuration
public class AsyncConfig {

  public static final String INVOICE_EXECUTOR = "invoiceTaskExecutor";
  public static final String SIGNING_EXECUTOR = "signingTaskExecutor";

  @Bean(name = INVOICE_EXECUTOR)
  ThreadPoolTaskExecutor invoiceTaskExecutor(AsyncProperties properties) {
    return executor(
        "invoice-",
        properties.corePoolSize(),
        properties.maxPoolSize(),
        properties.queueCapacity());
  }

  @Bean(name = SIGNING_EXECUTOR)
  ThreadPoolTaskExecutor signingTaskExecutor(AsyncProperties properties) {
    return executor(
        "signing-",
        properties.signingPoolSize(),
        properties.signingPoolSize(),
        properties.queueCapacity());
  }

  private static ThreadPoolTaskExecutor executor(
      String prefix, int corePoolSize, int maxPoolSize, int queueCapacity) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(prefix);
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setTaskDecorator(new TenantContextTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
