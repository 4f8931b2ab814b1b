package com.goodmem.outcome;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The success variant of {@link Result}. Immutable; may hold null.
 *
 * @param <T> the success type
 * @param <E> the error type this result would have carried
 */
public final class Ok<T, E> implements Result<T, E> {
  private final T value;

  public Ok(@Nullable T value) {
    this.value = value;
  }

  /** Returns the held value. */
  @Nullable
  public T value() {
    return value;
  }

  @Override
  public boolean isOk() {
    return true;
  }

  @Override
  public boolean isErr() {
    return false;
  }

  @Override
  public boolean isOkAnd(@Nonnull Predicate<? super T> predicate) {
    return predicate.test(value);
  }

  @Override
  public boolean isErrAnd(@Nonnull Predicate<? super E> predicate) {
    return false;
  }

  @Nonnull
  @Override
  public Option<T> ok() {
    return Option.fromNullable(value);
  }

  @Nonnull
  @Override
  public Option<E> err() {
    return None.instance();
  }

  @Override
  public T unwrap() {
    return value;
  }

  @Override
  public E unwrapErr() {
    throw new ResultException("Unwrapping error value on " + this);
  }

  @Override
  public T unwrapOr(T defaultValue) {
    return value;
  }

  @Override
  public T unwrapOrElse(@Nonnull Function<? super E, ? extends T> fn) {
    return value;
  }

  @Override
  public T expect(@Nonnull String message) {
    return value;
  }

  @Override
  public E expectErr(@Nonnull String message) {
    String text = message + ": " + Payloads.plain(value);
    if (value instanceof Throwable cause) {
      throw new ResultException(text, cause);
    }
    throw new ResultException(text);
  }

  @Nonnull
  @Override
  public <U> Result<U, E> map(@Nonnull Function<? super T, ? extends U> fn) {
    return new Ok<>(fn.apply(value));
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <F> Result<T, F> mapErr(@Nonnull Function<? super E, ? extends F> fn) {
    // An Ok holds no error, so only the phantom type parameter changes.
    return (Result<T, F>) this;
  }

  @Nonnull
  @Override
  public <U> Result<U, E> and(@Nonnull Result<U, E> other) {
    return other;
  }

  @Nonnull
  @Override
  public <U> Result<U, E> andThen(@Nonnull Function<? super T, Result<U, E>> fn) {
    return fn.apply(value);
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <F> Result<T, F> or(@Nonnull Result<T, F> other) {
    return (Result<T, F>) this;
  }

  @Nonnull
  @Override
  @SuppressWarnings("unchecked")
  public <F> Result<T, F> orElse(@Nonnull Function<? super E, Result<T, F>> fn) {
    return (Result<T, F>) this;
  }

  @Nonnull
  @Override
  public Option<Result<T, E>> transpose() {
    return value == null ? None.instance() : new Some<>(this);
  }

  @Override
  public <U> U match(
      @Nonnull Function<? super T, ? extends U> ok, @Nonnull Function<? super E, ? extends U> err) {
    return ok.apply(value);
  }

  @Override
  public String toString() {
    return "Ok(" + Payloads.render(value) + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Ok<?, ?> other = (Ok<?, ?>) obj;
    return Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Ok.class, value);
  }
}
