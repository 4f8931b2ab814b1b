package com.goodmem.outcome;

/**
 * Wraps a throwable that is not an {@link Exception} when {@link Attempt} converts it into an
 * error payload with the default mapper.
 */
public class AttemptException extends RuntimeException {

  public AttemptException(String message, Throwable cause) {
    super(message, cause);
  }
}
