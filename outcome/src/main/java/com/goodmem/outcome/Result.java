package com.goodmem.outcome;

import com.goodmem.outcome.function.ThrowingFunction;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Either a success value ({@link Ok}) or an error value ({@link Err}).
 *
 * <p>The error type is unconstrained: it may be an exception, a status object, a string or any
 * other domain type. Calling an accessor on the wrong variant ({@link #unwrap()} on an {@link
 * Err}, {@link #unwrapErr()} on an {@link Ok}, and the {@code expect} forms) throws {@link
 * ResultException}, which is never confused with the carried error.
 *
 * <p>Operations that do not apply to the current variant return the same instance: {@code
 * err.map(f)} is {@code err}, {@code ok.mapErr(f)} is {@code ok}, and the callback is not called.
 *
 * <p>Example:
 *
 * <pre>
 * Result&lt;Integer, String&gt; parsed = parse(input);
 * String message = parsed
 *     .map(n -&gt; n * 2)
 *     .match(n -&gt; "doubled: " + n, error -&gt; "failed: " + error);
 * </pre>
 *
 * @param <T> the success type
 * @param <E> the error type
 */
public sealed interface Result<T, E> extends IntoOption<T> permits Ok, Err {

  /** Creates an {@link Ok} holding {@code value}. */
  @Nonnull
  static <T, E> Result<T, E> ok(@Nullable T value) {
    return new Ok<>(value);
  }

  /** Creates an {@link Err} holding {@code error}. */
  @Nonnull
  static <T, E> Result<T, E> err(@Nullable E error) {
    return new Err<>(error);
  }

  /** Delegates to the conversion capability of {@code convertible}. */
  @Nonnull
  static <T, E> Result<T, E> from(@Nonnull IntoResult<T, E> convertible) {
    return convertible.intoResult();
  }

  /**
   * Awaits {@code stage}: normal completion gives {@code Ok(value)}, exceptional completion gives
   * {@code Err(errorMapper(cause))}. Completion wrappers are stripped before mapping.
   */
  @Nonnull
  static <T, E> CompletableFuture<Result<T, E>> fromFuture(
      @Nonnull CompletionStage<? extends T> stage,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    return Attempt.settle(stage, errorMapper);
  }

  /**
   * Wraps a throwing function into one that returns a Result. See {@link
   * Attempt#withAttempt(ThrowingFunction, Function)}.
   */
  @Nonnull
  static <A, T, E> Function<A, Result<T, E>> fromThrowable(
      @Nonnull ThrowingFunction<? super A, ? extends T> fn,
      @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    return Attempt.withAttempt(fn, errorMapper);
  }

  /** Returns true if this is an {@link Ok}. */
  boolean isOk();

  /** Returns true if this is an {@link Err}. */
  boolean isErr();

  /** Returns true if this is an {@link Ok} whose value satisfies {@code predicate}. */
  boolean isOkAnd(@Nonnull Predicate<? super T> predicate);

  /** Returns true if this is an {@link Err} whose error satisfies {@code predicate}. */
  boolean isErrAnd(@Nonnull Predicate<? super E> predicate);

  /** Projects the success value. An {@link Err}, or an {@link Ok} holding null, gives None. */
  @Nonnull
  Option<T> ok();

  /** Projects the error value. An {@link Ok}, or an {@link Err} holding null, gives None. */
  @Nonnull
  Option<E> err();

  /**
   * Returns the success value.
   *
   * @throws ResultException if this is an {@link Err}
   */
  T unwrap();

  /**
   * Returns the error value.
   *
   * @throws ResultException if this is an {@link Ok}
   */
  E unwrapErr();

  /** Returns the success value, or {@code defaultValue} if this is an {@link Err}. */
  T unwrapOr(T defaultValue);

  /** Returns the success value, or {@code fn} applied to the error if this is an {@link Err}. */
  T unwrapOrElse(@Nonnull Function<? super E, ? extends T> fn);

  /**
   * Returns the success value.
   *
   * @throws ResultException with message {@code "<message>: <error>"} if this is an {@link Err}
   */
  T expect(@Nonnull String message);

  /**
   * Returns the error value.
   *
   * @throws ResultException with message {@code "<message>: <value>"} if this is an {@link Ok}
   */
  E expectErr(@Nonnull String message);

  /** Transforms the success value; an {@link Err} is returned as is. */
  @Nonnull
  <U> Result<U, E> map(@Nonnull Function<? super T, ? extends U> fn);

  /** Transforms the error value; an {@link Ok} is returned as is. */
  @Nonnull
  <F> Result<T, F> mapErr(@Nonnull Function<? super E, ? extends F> fn);

  /** Returns {@code other} if this is an {@link Ok}, otherwise this {@link Err}. */
  @Nonnull
  <U> Result<U, E> and(@Nonnull Result<U, E> other);

  /** Returns {@code fn(value)} if this is an {@link Ok}, otherwise this {@link Err}. */
  @Nonnull
  <U> Result<U, E> andThen(@Nonnull Function<? super T, Result<U, E>> fn);

  /** Returns this if it is an {@link Ok}, otherwise {@code other}. */
  @Nonnull
  <F> Result<T, F> or(@Nonnull Result<T, F> other);

  /** Returns this if it is an {@link Ok}, otherwise {@code fn(error)}. */
  @Nonnull
  <F> Result<T, F> orElse(@Nonnull Function<? super E, Result<T, F>> fn);

  /**
   * Returns None for an {@link Ok} holding null, and {@code Some(this)} otherwise. Only null
   * counts as absent; zero, empty strings and empty collections do not.
   */
  @Nonnull
  Option<Result<T, E>> transpose();

  /** Invokes exactly one of the two handlers, depending on the variant. */
  <U> U match(
      @Nonnull Function<? super T, ? extends U> ok, @Nonnull Function<? super E, ? extends U> err);

  /** Same as {@link #ok()}. */
  @Nonnull
  @Override
  default Option<T> intoOption() {
    return ok();
  }
}
