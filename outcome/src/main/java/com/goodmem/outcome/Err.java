package com.goodmem.outcome;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The failure variant of {@link Result}. Immutable; the error may be any value, null included.
 *
 * @param <T> the success type this result would have carried
 * @param <E> the error type
 */
public final class Err<T, E> implements Result<T, E> {
  private final E error;

  public Err(@Nullable E error) {
    this.error = error;
  }

  /** Returns the held error. */
  @Nullable
  public E error() {
    return error;
  }

  @Override
  public boolean isOk() {
    return false;
  }

  @Override
  public boolean isErr() {
    return true;
  }

  @Override
  public boolean isOkAnd(@Nonnull Predicate<? super T> predicate) {
    return false;
  }

  @Override
  public boolean isErrAnd(@Nonnull Predicate<? super E> predicate) {
    return predicate.test(error);
  }

  @Nonnull
  @Override
  public Option<T> ok() {
    return None.instance();
  }

  @Nonnull
  @Override
  public Option<E> err() {
    return Option.fromNullable(error);
  }

  @Override
  public T unwrap() {
    String message = "Unwrapping value on " + this;
    if (error instanceof Throwable cause) {
      throw new ResultException(message, cause);
    }
    throw new ResultException(message);
  }

  @Override
  public E unwrapErr() {
    return error;
  }

  @Override
  public T unwrapOr(T defaultValue) {
    return defaultValue;
  }

  @Override
  public T unwrapOrElse(@Nonnull Function<? super E, ? extends T> fn) {
    return fn.apply(error);
  }

  @Override
  public T expect(@Nonnull String message) {
    String text = message + ": " + Payloads.plain(error);
    if (error instanceof Throwable cause) {
      throw new ResultException(text, cause);
    }
    throw new ResultException(text);
  }

  @Override
  public E expectErr(@Nonnull String message) {
    return error;
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <U> Result<U, E> map(@Nonnull Function<? super T, ? extends U> fn) {
    // An Err holds no value, so only the phantom type parameter changes.
    return (Result<U, E>) this;
  }

  @Nonnull
  @Override
  public <F> Result<T, F> mapErr(@Nonnull Function<? super E, ? extends F> fn) {
    return new Err<>(fn.apply(error));
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <U> Result<U, E> and(@Nonnull Result<U, E> other) {
    return (Result<U, E>) this;
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <U> Result<U, E> andThen(@Nonnull Function<? super T, Result<U, E>> fn) {
    return (Result<U, E>) this;
  }

  @Nonnull
  @Override
  public <F> Result<T, F> or(@Nonnull Result<T, F> other) {
    return other;
  }

  @Nonnull
  @Override
  public <F> Result<T, F> orElse(@Nonnull Function<? super E, Result<T, F>> fn) {
    return fn.apply(error);
  }

  @Nonnull
  @Override
  public Option<Result<T, E>> transpose() {
    return new Some<>(this);
  }

  @Override
  public <U> U match(
      @Nonnull Function<? super T, ? extends U> ok, @Nonnull Function<? super E, ? extends U> err) {
    return err.apply(error);
  }

  @Override
  public String toString() {
    return "Err(" + Payloads.render(error) + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Err<?, ?> other = (Err<?, ?>) obj;
    return Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Err.class, error);
  }
}
