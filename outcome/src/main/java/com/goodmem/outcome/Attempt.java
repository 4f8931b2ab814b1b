package com.goodmem.outcome;

import com.goodmem.outcome.function.ThrowingBiFunction;
import com.goodmem.outcome.function.ThrowingFunction;
import com.goodmem.outcome.function.ThrowingSupplier;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Bridges code that throws into code that returns {@link Result}.
 *
 * <p>Each call invokes the wrapped computation exactly once and never re-throws what it caught:
 * a return value becomes {@link Ok}, a thrown {@link Exception} (or, for the async forms, an
 * exceptional completion) becomes {@link Err} after passing through an error mapper.
 *
 * <p>{@link Error}s thrown synchronously are not caught, by {@link #attempt} or by the part of
 * {@link #attemptAsync} that runs before the stage exists. A stage that completes exceptionally
 * with an {@link Error} is different: the failure has already been captured by the stage, so it
 * becomes an {@link Err} like any other cause, wrapped in {@link AttemptException} by the default
 * mapper.
 *
 * <p>An unwrap failure of an enclosing {@link Try} or {@link Maybe} sequence is not a failure of
 * the attempted call. It passes through and stops that sequence.
 *
 * <p>The default error mapper is {@link #toException(Throwable)}.
 *
 * <pre>
 * Result&lt;Integer, Exception&gt; port = Attempt.attempt(() -&gt; Integer.parseInt(raw));
 *
 * Function&lt;String, Result&lt;URI, Status&gt;&gt; parseUri =
 *     Attempt.withAttempt((String s) -&gt; new URI(s), Status::fromThrowable);
 * </pre>
 */
public final class Attempt {

  private Attempt() {
    // Utility class, no instances
  }

  /**
   * Default error mapper. An {@link Exception} is returned as is; any other throwable is wrapped
   * in an {@link AttemptException} whose message is the throwable's string form.
   */
  @Nonnull
  public static Exception toException(@Nonnull Throwable throwable) {
    if (throwable instanceof Exception exception) {
      return exception;
    }
    return new AttemptException(String.valueOf(throwable), throwable);
  }

  /** Invokes {@code fn} once and captures its outcome, using the default error mapper. */
  @Nonnull
  public static <T> Result<T, Exception> attempt(@Nonnull ThrowingSupplier<? extends T> fn) {
    return attempt(fn, Attempt::toException);
  }

  /** Invokes {@code fn} once and captures its outcome, mapping a thrown exception to the error. */
  @Nonnull
  public static <T, E> Result<T, E> attempt(
      @Nonnull ThrowingSupplier<? extends T> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(errorMapper);
    try {
      return new Ok<>(fn.get());
    } catch (ShortCircuit signal) {
      throw signal;
    } catch (Exception e) {
      Logger.debug(e, "Attempted call threw {}", e.getClass().getName());
      return new Err<>(errorMapper.apply(e));
    }
  }

  /**
   * Invokes {@code fn} once and awaits the stage it returns, using the default error mapper.
   *
   * @see #attemptAsync(ThrowingSupplier, Function)
   */
  @Nonnull
  public static <T> CompletableFuture<Result<T, Exception>> attemptAsync(
      @Nonnull ThrowingSupplier<? extends CompletionStage<? extends T>> fn) {
    return attemptAsync(fn, Attempt::toException);
  }

  /**
   * Invokes {@code fn} once and awaits the stage it returns. Normal completion gives {@link Ok};
   * exceptional completion gives {@link Err} of the mapped cause. If {@code fn} throws before
   * producing a stage, or produces null, the returned future is already complete with an {@link
   * Err}.
   */
  @Nonnull
  public static <T, E> CompletableFuture<Result<T, E>> attemptAsync(
      @Nonnull ThrowingSupplier<? extends CompletionStage<? extends T>> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(errorMapper);
    CompletionStage<? extends T> stage;
    try {
      stage = Objects.requireNonNull(fn.get(), "Asynchronous call returned no stage");
    } catch (ShortCircuit signal) {
      throw signal;
    } catch (Exception e) {
      Logger.debug(e, "Asynchronous call threw {} before producing a stage", e.getClass().getName());
      return CompletableFuture.completedFuture(new Err<>(errorMapper.apply(e)));
    }
    return settle(stage, errorMapper);
  }

  /** Lifts {@code fn} into a supplier whose every call is an {@link #attempt}. */
  @Nonnull
  public static <T> Supplier<Result<T, Exception>> withAttempt(
      @Nonnull ThrowingSupplier<? extends T> fn) {
    return withAttempt(fn, Attempt::toException);
  }

  /** Lifts {@code fn} into a supplier whose every call is an {@link #attempt}. */
  @Nonnull
  public static <T, E> Supplier<Result<T, E>> withAttempt(
      @Nonnull ThrowingSupplier<? extends T> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(fn);
    Objects.requireNonNull(errorMapper);
    return () -> attempt(fn, errorMapper);
  }

  /** Lifts {@code fn} into a function whose every call is an {@link #attempt}. */
  @Nonnull
  public static <A, T> Function<A, Result<T, Exception>> withAttempt(
      @Nonnull ThrowingFunction<? super A, ? extends T> fn) {
    return withAttempt(fn, Attempt::toException);
  }

  /** Lifts {@code fn} into a function whose every call is an {@link #attempt}. */
  @Nonnull
  public static <A, T, E> Function<A, Result<T, E>> withAttempt(
      @Nonnull ThrowingFunction<? super A, ? extends T> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(fn);
    Objects.requireNonNull(errorMapper);
    return a -> attempt(() -> fn.apply(a), errorMapper);
  }

  /** Lifts {@code fn} into a two-argument function whose every call is an {@link #attempt}. */
  @Nonnull
  public static <A, B, T> BiFunction<A, B, Result<T, Exception>> withAttempt(
      @Nonnull ThrowingBiFunction<? super A, ? super B, ? extends T> fn) {
    return withAttempt(fn, Attempt::toException);
  }

  /** Lifts {@code fn} into a two-argument function whose every call is an {@link #attempt}. */
  @Nonnull
  public static <A, B, T, E> BiFunction<A, B, Result<T, E>> withAttempt(
      @Nonnull ThrowingBiFunction<? super A, ? super B, ? extends T> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(fn);
    Objects.requireNonNull(errorMapper);
    return (a, b) -> attempt(() -> fn.apply(a, b), errorMapper);
  }

  /** Lifts an asynchronous {@code fn} into a supplier whose every call is an {@link #attemptAsync}. */
  @Nonnull
  public static <T> Supplier<CompletableFuture<Result<T, Exception>>> withAttemptAsync(
      @Nonnull ThrowingSupplier<? extends CompletionStage<? extends T>> fn) {
    Objects.requireNonNull(fn);
    return () -> attemptAsync(fn);
  }

  /** Lifts an asynchronous {@code fn} into a function whose every call is an {@link #attemptAsync}. */
  @Nonnull
  public static <A, T> Function<A, CompletableFuture<Result<T, Exception>>> withAttemptAsync(
      @Nonnull ThrowingFunction<? super A, ? extends CompletionStage<? extends T>> fn) {
    return withAttemptAsync(fn, Attempt::toException);
  }

  /** Lifts an asynchronous {@code fn} into a function whose every call is an {@link #attemptAsync}. */
  @Nonnull
  public static <A, T, E> Function<A, CompletableFuture<Result<T, E>>> withAttemptAsync(
      @Nonnull ThrowingFunction<? super A, ? extends CompletionStage<? extends T>> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(fn);
    Objects.requireNonNull(errorMapper);
    return a -> attemptAsync(() -> fn.apply(a), errorMapper);
  }

  static <T, E> CompletableFuture<Result<T, E>> settle(
      CompletionStage<? extends T> stage, Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(errorMapper);
    return stage
        .<Result<T, E>>handle(
            (value, failure) -> {
              if (failure == null) {
                return new Ok<>(value);
              }
              Throwable cause = unwrapCompletion(failure);
              if (cause instanceof ShortCircuit signal) {
                throw new CompletionException(signal);
              }
              Logger.debug(cause, "Asynchronous call failed with {}", cause.getClass().getName());
              return new Err<>(errorMapper.apply(cause));
            })
        .toCompletableFuture();
  }

  /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
  @Nonnull
  static Throwable unwrapCompletion(@Nonnull Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
