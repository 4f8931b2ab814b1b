package com.goodmem.outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.tinylog.Logger;

/**
 * Abort signal raised by a {@link Try.Scope} or {@link Maybe.Scope} unwrap when it meets a
 * failure. It unwinds the sequence back to the invocation that owns the scope, which returns the
 * carried failure. No stack trace is captured.
 */
final class ShortCircuit extends RuntimeException {
  private final transient Object owner;
  private final transient Object failure;

  ShortCircuit(Object owner, Object failure) {
    super("Unwrap failure escaped its sequence", null, false, false);
    this.owner = owner;
    this.failure = failure;
  }

  boolean ownedBy(Object scope) {
    return owner == scope;
  }

  @SuppressWarnings("unchecked")
  <R> R failure() {
    return (R) failure;
  }

  /**
   * Runs a synchronous sequence. A signal raised through {@code scope} becomes the return value;
   * signals of other scopes and every other exception propagate.
   */
  static <S, R> R run(S scope, Function<? super S, ? extends R> body, String label) {
    try {
      return Objects.requireNonNull(body.apply(scope), () -> label + " sequence returned null");
    } catch (ShortCircuit signal) {
      if (!signal.ownedBy(scope)) {
        throw signal;
      }
      Logger.trace("{} sequence short-circuited on {}", label, signal.failure);
      return signal.failure();
    }
  }

  /**
   * Runs an asynchronous sequence. A signal raised through {@code scope}, by the synchronous part
   * of the body or by the stage it returns, becomes the completion value. Any other failure,
   * including a null stage, completes the returned future exceptionally; only signals of other
   * scopes are thrown to the caller.
   */
  static <S, R> CompletableFuture<R> runAsync(
      S scope, Function<? super S, ? extends CompletionStage<? extends R>> body, String label) {
    CompletionStage<? extends R> stage;
    try {
      stage = Objects.requireNonNull(body.apply(scope), () -> label + " sequence returned no stage");
    } catch (ShortCircuit signal) {
      if (!signal.ownedBy(scope)) {
        throw signal;
      }
      Logger.trace("{} sequence short-circuited on {}", label, signal.failure);
      return CompletableFuture.completedFuture(signal.failure());
    } catch (RuntimeException e) {
      Logger.debug(e, "{} sequence failed before producing a stage", label);
      return CompletableFuture.failedFuture(e);
    }
    return stage
        .<R>handle(
            (value, failure) -> {
              if (failure == null) {
                return Objects.requireNonNull(value, () -> label + " sequence completed with null");
              }
              Throwable cause = Attempt.unwrapCompletion(failure);
              if (cause instanceof ShortCircuit signal && signal.ownedBy(scope)) {
                Logger.trace("{} sequence short-circuited on {}", label, signal.failure);
                return signal.failure();
              }
              throw failure instanceof CompletionException completion
                  ? completion
                  : new CompletionException(failure);
            })
        .toCompletableFuture();
  }
}
