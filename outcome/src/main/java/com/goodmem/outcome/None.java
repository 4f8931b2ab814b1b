package com.goodmem.outcome;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import javax.annotation.Nonnull;

/**
 * The absent variant of {@link Option}.
 *
 * <p>There is exactly one instance, created eagerly and shared across all type parameters, so
 * two {@code None} values are always the same reference.
 *
 * @param <T> the type a present value would have had
 */
public final class None<T> implements Option<T> {
  private static final None<?> INSTANCE = new None<>();

  static final String UNWRAP_MESSAGE = "Unwrap called on None";

  private None() {}

  /** Returns the shared instance. */
  @SuppressWarnings("unchecked")
  @Nonnull
  public static <T> None<T> instance() {
    return (None<T>) INSTANCE;
  }

  @Override
  public boolean isSome() {
    return false;
  }

  @Override
  public boolean isNone() {
    return true;
  }

  @Override
  public boolean isSomeAnd(@Nonnull Predicate<? super T> predicate) {
    return false;
  }

  @Override
  public boolean isNoneOr(@Nonnull Predicate<? super T> predicate) {
    return true;
  }

  @Nonnull
  @Override
  public T expect(@Nonnull String message) {
    throw new OptionException(message);
  }

  @Nonnull
  @Override
  public T unwrap() {
    throw new OptionException(UNWRAP_MESSAGE);
  }

  @Override
  public T unwrapOr(T defaultValue) {
    return defaultValue;
  }

  @Override
  public T unwrapOrElse(@Nonnull Supplier<? extends T> fn) {
    return fn.get();
  }

  @Nonnull
  @Override
  public <U> Option<U> map(@Nonnull Function<? super T, ? extends U> fn) {
    return instance();
  }

  @Override
  public <U> U mapOr(U defaultValue, @Nonnull Function<? super T, ? extends U> fn) {
    return defaultValue;
  }

  @Override
  public <U> U mapOrElse(
      @Nonnull Supplier<? extends U> defaultFn, @Nonnull Function<? super T, ? extends U> fn) {
    return defaultFn.get();
  }

  @Nonnull
  @Override
  public <E> Result<T, E> okOr(E error) {
    return new Err<>(error);
  }

  @Nonnull
  @Override
  public <E> Result<T, E> okOrElse(@Nonnull Supplier<? extends E> fn) {
    return new Err<>(fn.get());
  }

  @Nonnull
  @Override
  public Option<T> filter(@Nonnull Predicate<? super T> predicate) {
    return this;
  }

  @Nonnull
  @Override
  public <U> Option<U> and(@Nonnull Option<U> other) {
    return instance();
  }

  @Nonnull
  @Override
  public <U> Option<U> andThen(@Nonnull Function<? super T, Option<U>> fn) {
    return instance();
  }

  @Nonnull
  @Override
  public Option<T> or(@Nonnull Option<T> other) {
    return other;
  }

  @Nonnull
  @Override
  public Option<T> orElse(@Nonnull Supplier<Option<T>> fn) {
    return fn.get();
  }

  @Override
  public <U> U match(
      @Nonnull Function<? super T, ? extends U> some, @Nonnull Supplier<? extends U> none) {
    return none.get();
  }

  @Nonnull
  @Override
  public Optional<T> toOptional() {
    return Optional.empty();
  }

  @Nonnull
  @Override
  public Result<T, Exception> intoResult() {
    return new Err<>(new NoSuchElementException("No value"));
  }

  @Override
  public String toString() {
    return "None";
  }
}
