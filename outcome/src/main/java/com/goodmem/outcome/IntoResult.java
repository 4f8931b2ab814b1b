package com.goodmem.outcome;

import javax.annotation.Nonnull;

/**
 * Capability of a type that knows how to describe itself as a {@link Result}.
 *
 * <p>Host error types implement this so that {@link Result#from(IntoResult)} can turn them into
 * a failure (or success) without the caller branching on them.
 *
 * @param <T> the success type
 * @param <E> the error type
 */
@FunctionalInterface
public interface IntoResult<T, E> {

  /** Converts this value into a {@link Result}. */
  @Nonnull
  Result<T, E> intoResult();
}
