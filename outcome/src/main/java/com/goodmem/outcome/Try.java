package com.goodmem.outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Early-return composition over {@link Result}.
 *
 * <p>The body receives a {@link Scope}. Each {@link Scope#unwrap(Result)} either returns the
 * success value or stops the body at that point, in which case the invocation returns that very
 * {@link Err}. If the body runs to the end, its own {@code Result} is returned unchanged; the body
 * must produce a {@code Result}, not a bare value.
 *
 * <pre>
 * Result&lt;Integer, String&gt; sum = Try.run(scope -&gt; {
 *   int a = scope.unwrap(parse("1"));
 *   int b = scope.unwrap(parse("x")); // stops here with Err("not a number: x")
 *   return Result.ok(a + b);
 * });
 * </pre>
 *
 * <p>Exceptions thrown by the body are not converted: they reach the caller of {@link #run}, or
 * complete the future of {@link #runAsync} exceptionally. Use {@link #catching} for a body that
 * should turn exceptions into errors.
 *
 * <p>Invocations nest. Each owns its scope, and an abort raised through an outer scope from
 * inside an inner invocation passes through the inner one.
 */
public final class Try {

  private Try() {
    // Utility class, no instances
  }

  /** Runs a synchronous sequence; returns the first {@link Err} unwrapped, or the body's result. */
  @Nonnull
  public static <T, E> Result<T, E> run(@Nonnull Function<Scope<E>, Result<T, E>> body) {
    return ShortCircuit.<Scope<E>, Result<T, E>>run(new Scope<>(), body, "Try");
  }

  /**
   * Runs an asynchronous sequence. The returned future completes with the first {@link Err}
   * unwrapped, through {@link Scope#unwrap} or {@link Scope#unwrapAsync}, or with the result the
   * body's stage completes with.
   */
  @Nonnull
  public static <T, E> CompletableFuture<Result<T, E>> runAsync(
      @Nonnull Function<Scope<E>, ? extends CompletionStage<Result<T, E>>> body) {
    return ShortCircuit.<Scope<E>, Result<T, E>>runAsync(new Scope<>(), body, "Try");
  }

  /**
   * Runs a block whose plain return value is wrapped in {@link Ok}. Unwrap failures return the
   * {@link Err} as in {@link #run}, and any {@link Exception} thrown by the block becomes {@code
   * Err(errorMapper(exception))}.
   */
  @Nonnull
  public static <T, E> Result<T, E> catching(
      @Nonnull Block<T, E> block, @Nonnull Function<? super Throwable, ? extends E> errorMapper) {
    Objects.requireNonNull(errorMapper);
    Scope<E> scope = new Scope<>();
    return ShortCircuit.<Scope<E>, Result<T, E>>run(
        scope,
        s -> {
          try {
            return new Ok<>(block.apply(s));
          } catch (ShortCircuit signal) {
            throw signal;
          } catch (Exception e) {
            Logger.debug(e, "Try block threw {}", e.getClass().getName());
            return new Err<>(errorMapper.apply(e));
          }
        },
        "Try");
  }

  /** Body of {@link #catching}: returns a plain value and may throw. */
  @FunctionalInterface
  public interface Block<T, E> {
    T apply(Scope<E> scope) throws Exception;
  }

  /**
   * Unwrap operator handed to a {@link Try} body. Only valid during the invocation that created
   * it.
   *
   * @param <E> the error type of the sequence
   */
  public static final class Scope<E> {

    private Scope() {}

    /** Returns the success value, or stops the sequence with {@code result} if it is an Err. */
    public <T> T unwrap(@Nonnull Result<T, ? extends E> result) {
      if (result.isOk()) {
        return result.unwrap();
      }
      throw new ShortCircuit(this, result);
    }

    /**
     * Awaits {@code stage} and unwraps its result. The returned future fails with this scope's
     * abort signal on Err, which the enclosing {@link Try#runAsync} turns back into that Err.
     */
    @Nonnull
    public <T> CompletableFuture<T> unwrapAsync(
        @Nonnull CompletionStage<? extends Result<T, ? extends E>> stage) {
      return stage.thenApply(result -> this.<T>unwrap(result)).toCompletableFuture();
    }
  }
}
