package io.invoicedesk.backend.operations;

import io.invoicedesk.backend.config.AsyncConfig;
import io.invoicedesk.backend.document.InvoiceDocumentService;
import io.invoicedesk.backend.exception.ResourceConflictException;
import io.invoicedesk.backend.invoice.DocumentArtifact;
import io.invoicedesk.backend.invoice.InvoiceService;
import io.invoicedesk.backend.invoice.dto.InvoiceResponse;
import io.invoicedesk.backend.signing.InvoiceSigningService;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Asynchronous entry points for the long-running invoice operations. Each call returns
 * immediately; the work runs on a worker pool with the caller's company bound, and cancelling the
 * returned future requests cancellation of the work.
 */
@Service
public class InvoiceOperations {

  private static final Logger log = LoggerFactory.getLogger(InvoiceOperations.class);

  private final InvoiceService invoiceService;
  private final InvoiceDocumentService documentService;
  private final InvoiceSigningService signingService;
  private final Executor invoiceExecutor;
  private final Executor signingExecutor;
  private final RetryTemplate issueRetry;

  public InvoiceOperations(
      InvoiceService invoiceService,
      InvoiceDocumentService documentService,
      InvoiceSigningService signingService,
      @Qualifier(AsyncConfig.INVOICE_EXECUTOR) Executor invoiceExecutor,
      @Qualifier(AsyncConfig.SIGNING_EXECUTOR) Executor signingExecutor,
      IssuanceProperties issuanceProperties) {
    this.invoiceService = invoiceService;
    this.documentService = documentService;
    this.signingService = signingService;
    this.invoiceExecutor = invoiceExecutor;
    this.signingExecutor = signingExecutor;
    this.issueRetry =
        RetryTemplate.builder()
            .maxAttempts(issuanceProperties.maxAttempts())
            .exponentialBackoff(
                issuanceProperties.initialBackoff().toMillis(),
                2.0,
                issuanceProperties.maxBackoff().toMillis())
            .retryOn(ResourceConflictException.class)
            .traversingCauses()
            .withListener(new ConflictLoggingListener())
            .build();
  }

  /**
   * Issues a draft. Attempts that lose a race against a concurrent issuance are retried from
   * scratch; each attempt runs in its own transaction.
   */
  public CompletableFuture<InvoiceResponse> issue(UUID invoiceId, CancellationToken token) {
    return submit(
        invoiceExecutor,
        token,
        () ->
            issueRetry.execute(
                context -> {
                  token.throwIfCancellationRequested();
                  return translateStoreConflicts(() -> invoiceService.issue(invoiceId, token));
                }));
  }

  /** Returns the cached unsigned document, rendering it when absent or when forced. */
  public CompletableFuture<DocumentArtifact> exportUnsigned(
      UUID invoiceId, boolean forceRegenerate, CancellationToken token) {
    return submit(
        invoiceExecutor,
        token,
        () ->
            translateStoreConflicts(
                () -> documentService.getOrRenderUnsigned(invoiceId, forceRegenerate, token)));
  }

  /** Signs the invoice's document on the signing pool. */
  public CompletableFuture<DocumentArtifact> sign(UUID invoiceId, CancellationToken token) {
    return submit(
        signingExecutor,
        token,
        () -> translateStoreConflicts(() -> signingService.sign(invoiceId, token)));
  }

  private static <T> CompletableFuture<T> submit(
      Executor executor, CancellationToken token, Supplier<T> work) {
    return token.linkTo(CompletableFuture.supplyAsync(work, executor));
  }

  /**
   * Store races surface at flush or commit as Spring data access exceptions, outside the service
   * that caused them.
   */
  static <T> T translateStoreConflicts(Supplier<T> work) {
    try {
      return work.get();
    } catch (ConcurrencyFailureException e) {
      throw new ResourceConflictException(
          "store.concurrent_modification",
          "Concurrent modification",
          "The resource was modified concurrently; retry the operation",
          e);
    } catch (DataIntegrityViolationException e) {
      throw new ResourceConflictException(
          "store.constraint_violation",
          "Constraint violation",
          "A concurrent writer claimed the same unique value; retry the operation",
          e);
    }
  }

  private static final class ConflictLoggingListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      log.warn(
          "Issuance attempt {} lost a race: {}",
          context.getRetryCount(),
          throwable.getMessage());
    }
  }
}
