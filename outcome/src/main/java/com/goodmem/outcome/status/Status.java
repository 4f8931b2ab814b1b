package com.goodmem.outcome.status;

import static com.google.common.base.Preconditions.checkNotNull;

import com.goodmem.outcome.IntoResult;
import com.goodmem.outcome.Result;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The status of an operation, possibly with a message and a cause. Modeled on the gRPC status
 * concept, it serves as a structured error payload for {@link Result}.
 *
 * <p>A status converts itself into a result: {@link #intoResult()} gives {@code Ok(null)} for an
 * OK status and {@code Err(this)} otherwise, so {@code Result.from(status)} needs no branching.
 * {@link #fromThrowable(Throwable)} can be passed wherever an error mapper is expected:
 *
 * <pre>
 * Result&lt;Integer, Status&gt; port = Attempt.attempt(() -&gt; Integer.parseInt(raw), Status::fromThrowable);
 * </pre>
 */
public final class Status implements IntoResult<Void, Status> {
  private final StatusCode code;
  private final String message;
  private final Throwable cause;

  private Status(StatusCode code, String message, Throwable cause) {
    this.code = checkNotNull(code, "code");
    this.message = message;
    this.cause = cause;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause);
  }

  /** Creates a new OK status. */
  public static Status ok() {
    return new Status(StatusCode.OK, null, null);
  }

  /** Creates a new NOT_FOUND status with the given message. */
  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  /** Creates a new INTERNAL status with the given message and cause. */
  public static Status internal(String message, Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Creates a new INVALID_ARGUMENT status with the given message. */
  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** Creates a new FAILED_PRECONDITION status with the given message. */
  public static Status failedPrecondition(String message) {
    return new Status(StatusCode.FAILED_PRECONDITION, message, null);
  }

  /** Creates a new UNIMPLEMENTED status with the given message. */
  public static Status unimplemented(String message) {
    return new Status(StatusCode.UNIMPLEMENTED, message, null);
  }

  /**
   * Maps a throwable onto the closest status code, keeping it as the cause.
   *
   * <ul>
   *   <li>{@link IllegalArgumentException} (including {@link NumberFormatException}) to
   *       INVALID_ARGUMENT
   *   <li>{@link NoSuchElementException} to NOT_FOUND
   *   <li>{@link IllegalStateException} to FAILED_PRECONDITION
   *   <li>{@link UnsupportedOperationException} to UNIMPLEMENTED
   *   <li>{@link TimeoutException} to DEADLINE_EXCEEDED
   *   <li>{@link CancellationException} to CANCELLED
   *   <li>anything else to INTERNAL, with the message prefixed by "Exception: "
   * </ul>
   */
  @Nonnull
  public static Status fromThrowable(@Nonnull Throwable throwable) {
    String detail = throwable.getMessage();
    if (throwable instanceof IllegalArgumentException) {
      return new Status(StatusCode.INVALID_ARGUMENT, detail, throwable);
    } else if (throwable instanceof NoSuchElementException) {
      return new Status(StatusCode.NOT_FOUND, detail, throwable);
    } else if (throwable instanceof IllegalStateException) {
      return new Status(StatusCode.FAILED_PRECONDITION, detail, throwable);
    } else if (throwable instanceof UnsupportedOperationException) {
      return new Status(StatusCode.UNIMPLEMENTED, detail, throwable);
    } else if (throwable instanceof TimeoutException) {
      return new Status(StatusCode.DEADLINE_EXCEEDED, detail, throwable);
    } else if (throwable instanceof CancellationException) {
      return new Status(StatusCode.CANCELLED, detail, throwable);
    }
    return new Status(StatusCode.INTERNAL, "Exception: " + detail, throwable);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  @Nullable
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  @Nullable
  public Throwable getCause() {
    return cause;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code.isError();
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code.isSuccess();
  }

  /** Returns {@code Ok(null)} for an OK status, {@code Err(this)} otherwise. */
  @Nonnull
  @Override
  public Result<Void, Status> intoResult() {
    return isOk() ? Result.ok(null) : Result.err(this);
  }

  /** Returns {@code Ok(value)} for an OK status, {@code Err(this)} otherwise. */
  @Nonnull
  public <T> Result<T, Status> toResult(@Nullable T value) {
    return isOk() ? Result.ok(value) : Result.err(this);
  }

  @Override
  public String toString() {
    if (message == null) {
      return code.toString();
    }
    return code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}
