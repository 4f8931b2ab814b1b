package com.goodmem.outcome;

import javax.annotation.Nonnull;

/**
 * Capability of a type that knows how to describe itself as an {@link Option}.
 *
 * @param <T> the type of the present value
 */
@FunctionalInterface
public interface IntoOption<T> {

  /** Converts this value into an {@link Option}. */
  @Nonnull
  Option<T> intoOption();
}
