package com.goodmem.outcome;

/**
 * Thrown when a {@link Result} accessor is called on the wrong variant, such as
 * {@link Result#unwrap()} on an {@link Err} or {@link Result#unwrapErr()} on an {@link Ok}.
 *
 * <p>This is distinct from the error payload carried by an {@link Err}: it reports misuse of
 * the library, never a domain error.
 */
public class ResultException extends IllegalStateException {

  public ResultException(String message) {
    super(message);
  }

  public ResultException(String message, Throwable cause) {
    super(message, cause);
  }
}
