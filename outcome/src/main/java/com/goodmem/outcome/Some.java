package com.goodmem.outcome;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * The present variant of {@link Option}. Holds exactly one non-null value, which never changes.
 *
 * @param <T> the type of the value
 */
public final class Some<T> implements Option<T> {
  private final T value;

  /**
   * Creates a new Some.
   *
   * @throws NullPointerException if value is null
   */
  public Some(@Nonnull T value) {
    this.value = Objects.requireNonNull(value, "Some cannot hold null, use Option.none()");
  }

  /** Returns the held value. */
  @Nonnull
  public T value() {
    return value;
  }

  @Override
  public boolean isSome() {
    return true;
  }

  @Override
  public boolean isNone() {
    return false;
  }

  @Override
  public boolean isSomeAnd(@Nonnull Predicate<? super T> predicate) {
    return predicate.test(value);
  }

  @Override
  public boolean isNoneOr(@Nonnull Predicate<? super T> predicate) {
    return predicate.test(value);
  }

  @Nonnull
  @Override
  public T expect(@Nonnull String message) {
    return value;
  }

  @Nonnull
  @Override
  public T unwrap() {
    return value;
  }

  @Override
  public T unwrapOr(T defaultValue) {
    return value;
  }

  @Override
  public T unwrapOrElse(@Nonnull Supplier<? extends T> fn) {
    return value;
  }

  @Nonnull
  @Override
  public <U> Option<U> map(@Nonnull Function<? super T, ? extends U> fn) {
    return Option.fromNullable(fn.apply(value));
  }

  @Override
  public <U> U mapOr(U defaultValue, @Nonnull Function<? super T, ? extends U> fn) {
    return fn.apply(value);
  }

  @Override
  public <U> U mapOrElse(
      @Nonnull Supplier<? extends U> defaultFn, @Nonnull Function<? super T, ? extends U> fn) {
    return fn.apply(value);
  }

  @Nonnull
  @Override
  public <E> Result<T, E> okOr(E error) {
    return new Ok<>(value);
  }

  @Nonnull
  @Override
  public <E> Result<T, E> okOrElse(@Nonnull Supplier<? extends E> fn) {
    return new Ok<>(value);
  }

  @Nonnull
  @Override
  public Option<T> filter(@Nonnull Predicate<? super T> predicate) {
    return predicate.test(value) ? this : None.instance();
  }

  @Nonnull
  @Override
  public <U> Option<U> and(@Nonnull Option<U> other) {
    return other;
  }

  @Nonnull
  @Override
  public <U> Option<U> andThen(@Nonnull Function<? super T, Option<U>> fn) {
    return fn.apply(value);
  }

  @Nonnull
  @Override
  public Option<T> or(@Nonnull Option<T> other) {
    return this;
  }

  @Nonnull
  @Override
  public Option<T> orElse(@Nonnull Supplier<Option<T>> fn) {
    return this;
  }

  @Override
  public <U> U match(
      @Nonnull Function<? super T, ? extends U> some, @Nonnull Supplier<? extends U> none) {
    return some.apply(value);
  }

  @Nonnull
  @Override
  public Optional<T> toOptional() {
    return Optional.of(value);
  }

  @Nonnull
  @Override
  public Result<T, Exception> intoResult() {
    return new Ok<>(value);
  }

  @Override
  public String toString() {
    return "Some(" + Payloads.render(value) + ")";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Some<?> other = (Some<?>) obj;
    return value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Some.class, value);
  }
}
