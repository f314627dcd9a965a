package io.invoicedesk.backend.operations;

import io.invoicedesk.backend.exception.OperationCancelledException;
import java.util.concurrent.CompletableFuture;

/**
 * Cooperative cancellation signal handed to long-running invoice operations. Work checks the token
 * at its commit boundaries: a cancelled operation never persists anything.
 */
public final class CancellationToken {

  private static final CancellationToken NONE = new CancellationToken(false);

  private final boolean cancellable;
  private volatile boolean cancellationRequested;

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  public static CancellationToken create() {
    return new CancellationToken(true);
  }

  /** A token that can never be cancelled. */
  public static CancellationToken none() {
    return NONE;
  }

  public void cancel() {
    if (cancellable) {
      cancellationRequested = true;
    }
  }

  public boolean isCancellationRequested() {
    return cancellationRequested;
  }

  /**
   * @throws OperationCancelledException if cancellation was requested
   */
  public void throwIfCancellationRequested() {
    if (cancellationRequested) {
      throw new OperationCancelledException(
          "operation.cancelled", "The operation was cancelled before it completed");
    }
  }

  /** Cancels this token when the given future is cancelled by its consumer. */
  public <T> CompletableFuture<T> linkTo(CompletableFuture<T> future) {
    future.whenComplete(
        (result, error) -> {
          if (future.isCancelled()) {
            cancel();
          }
        });
    return future;
  }
}
