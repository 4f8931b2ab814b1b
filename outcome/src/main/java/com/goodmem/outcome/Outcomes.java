package com.goodmem.outcome;

import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Free-function forms of the factories and of {@code match}, for static import.
 *
 * <pre>
 * import static com.goodmem.outcome.Outcomes.*;
 *
 * String label = match(lookup(key), value -&gt; "found " + value, () -&gt; "missing");
 * </pre>
 */
public final class Outcomes {

  private Outcomes() {
    // Utility class, no instances
  }

  @Nonnull
  public static <T, E> Result<T, E> ok(@Nullable T value) {
    return Result.ok(value);
  }

  @Nonnull
  public static <T, E> Result<T, E> err(@Nullable E error) {
    return Result.err(error);
  }

  @Nonnull
  public static <T> Option<T> some(@Nonnull T value) {
    return Option.some(value);
  }

  @Nonnull
  public static <T> Option<T> none() {
    return Option.none();
  }

  /** Same as {@link Result#match(Function, Function)}. */
  public static <T, E, U> U match(
      @Nonnull Result<T, E> result,
      @Nonnull Function<? super T, ? extends U> ok,
      @Nonnull Function<? super E, ? extends U> err) {
    return result.match(ok, err);
  }

  /** Same as {@link Option#match(Function, Supplier)}. */
  public static <T, U> U match(
      @Nonnull Option<T> option,
      @Nonnull Function<? super T, ? extends U> some,
      @Nonnull Supplier<? extends U> none) {
    return option.match(some, none);
  }
}
