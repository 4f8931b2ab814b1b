package com.goodmem.outcome;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A value that is either present ({@link Some}) or absent ({@link None}).
 *
 * <p>Unlike {@link Optional}, an {@code Option} is a closed pair of variants that can be narrowed
 * with {@code instanceof}, carries the full set of combinators, and converts to and from
 * {@link Result}. A {@link Some} never holds {@code null}; absence is always the shared {@link
 * None} instance.
 *
 * <p>Every operation is total except {@link #expect(String)} and {@link #unwrap()}, which throw
 * {@link OptionException} on {@link None}. Callbacks are only invoked when their variant is
 * present, so the fallback producers ({@link #unwrapOrElse}, {@link #mapOrElse}, {@link
 * #okOrElse}, {@link #orElse}) never run on {@link Some}.
 *
 * @param <T> the type of the present value
 */
public sealed interface Option<T> extends IntoResult<T, Exception> permits Some, None {

  /** Creates a {@link Some} holding {@code value}, which must not be null. */
  @Nonnull
  static <T> Option<T> some(@Nonnull T value) {
    return new Some<>(value);
  }

  /** Returns the shared {@link None} instance. */
  @Nonnull
  static <T> Option<T> none() {
    return None.instance();
  }

  /** Returns {@link None} for {@code null}, otherwise a {@link Some} of {@code value}. */
  @Nonnull
  static <T> Option<T> fromNullable(@Nullable T value) {
    return value == null ? None.instance() : new Some<>(value);
  }

  /**
   * Returns a {@link Some} of {@code value} if it satisfies {@code predicate}, otherwise {@link
   * None}. A null {@code value} gives {@link None} without consulting the predicate.
   */
  @Nonnull
  static <T> Option<T> fromPredicate(@Nullable T value, @Nonnull Predicate<? super T> predicate) {
    if (value == null) {
      return None.instance();
    }
    return predicate.test(value) ? new Some<>(value) : None.instance();
  }

  /** Delegates to the conversion capability of {@code convertible}. */
  @Nonnull
  static <T> Option<T> from(@Nonnull IntoOption<T> convertible) {
    return convertible.intoOption();
  }

  /** Converts a {@link java.util.Optional}. */
  @Nonnull
  static <T> Option<T> fromOptional(@Nonnull Optional<T> optional) {
    return optional.<Option<T>>map(Some::new).orElseGet(None::instance);
  }

  /** Returns true if this is a {@link Some}. */
  boolean isSome();

  /** Returns true if this is {@link None}. */
  boolean isNone();

  /**
   * Returns true if this is a {@link Some} whose value satisfies {@code predicate}. On {@link
   * None} the predicate is not called.
   */
  boolean isSomeAnd(@Nonnull Predicate<? super T> predicate);

  /**
   * Returns true if this is {@link None}, or a {@link Some} whose value satisfies {@code
   * predicate}. On {@link None} the predicate is not called.
   */
  boolean isNoneOr(@Nonnull Predicate<? super T> predicate);

  /**
   * Returns the value.
   *
   * @throws OptionException carrying {@code message} verbatim if this is {@link None}
   */
  @Nonnull
  T expect(@Nonnull String message);

  /**
   * Returns the value.
   *
   * @throws OptionException if this is {@link None}
   */
  @Nonnull
  T unwrap();

  /** Returns the value, or {@code defaultValue} if this is {@link None}. */
  T unwrapOr(T defaultValue);

  /** Returns the value, or the result of {@code fn} if this is {@link None}. */
  T unwrapOrElse(@Nonnull Supplier<? extends T> fn);

  /**
   * Applies {@code fn} to the value of a {@link Some}. A null result becomes {@link None}. {@link
   * None} is returned as is.
   */
  @Nonnull
  <U> Option<U> map(@Nonnull Function<? super T, ? extends U> fn);

  /** Applies {@code fn} to the value, or returns {@code defaultValue} on {@link None}. */
  <U> U mapOr(U defaultValue, @Nonnull Function<? super T, ? extends U> fn);

  /** Applies {@code fn} to the value, or returns the result of {@code defaultFn} on {@link None}. */
  <U> U mapOrElse(
      @Nonnull Supplier<? extends U> defaultFn, @Nonnull Function<? super T, ? extends U> fn);

  /** Converts to {@code Ok(value)}, or {@code Err(error)} on {@link None}. */
  @Nonnull
  <E> Result<T, E> okOr(E error);

  /** Converts to {@code Ok(value)}, or {@code Err(fn())} on {@link None}. */
  @Nonnull
  <E> Result<T, E> okOrElse(@Nonnull Supplier<? extends E> fn);

  /** Keeps a {@link Some} only if its value satisfies {@code predicate}. */
  @Nonnull
  Option<T> filter(@Nonnull Predicate<? super T> predicate);

  /** Returns {@code other} if this is a {@link Some}, otherwise {@link None}. */
  @Nonnull
  <U> Option<U> and(@Nonnull Option<U> other);

  /** Returns {@code fn(value)} if this is a {@link Some}, otherwise {@link None}. */
  @Nonnull
  <U> Option<U> andThen(@Nonnull Function<? super T, Option<U>> fn);

  /** Returns this if it is a {@link Some}, otherwise {@code other}. */
  @Nonnull
  Option<T> or(@Nonnull Option<T> other);

  /** Returns this if it is a {@link Some}, otherwise the result of {@code fn}. */
  @Nonnull
  Option<T> orElse(@Nonnull Supplier<Option<T>> fn);

  /** Invokes exactly one of the two handlers, depending on the variant. */
  <U> U match(@Nonnull Function<? super T, ? extends U> some, @Nonnull Supplier<? extends U> none);

  /** Converts to a {@link java.util.Optional}. */
  @Nonnull
  Optional<T> toOptional();

  /**
   * Converts to {@code Ok(value)}, or on {@link None} to an {@code Err} holding a {@link
   * java.util.NoSuchElementException} with the message "No value".
   */
  @Nonnull
  @Override
  Result<T, Exception> intoResult();
}
