package com.goodmem.outcome;

/**
 * Thrown when a value is demanded from an {@link Option} that holds none, for example by
 * {@link Option#unwrap()} or {@link Option#expect(String)} on {@link None}.
 *
 * <p>This signals a programming mistake, not a domain failure. Domain failures travel as
 * {@link None} values.
 */
public class OptionException extends IllegalStateException {

  public OptionException(String message) {
    super(message);
  }
}
