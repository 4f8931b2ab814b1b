package com.goodmem.outcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Early-return composition over {@link Option}, the counterpart of {@link Try}.
 *
 * <p>Each {@link Scope#unwrap(Option)} returns the present value or stops the body, in which
 * case the invocation returns {@link None}. If the body runs to the end its own {@code Option} is
 * returned unchanged. Exceptions thrown by the body propagate: {@link #run} throws them and
 * {@link #runAsync} completes its future with them.
 *
 * <pre>
 * Option&lt;String&gt; city = Maybe.run(scope -&gt; {
 *   User user = scope.unwrap(findUser(id));
 *   Address address = scope.unwrap(user.address());
 *   return Option.fromNullable(address.city());
 * });
 * </pre>
 */
public final class Maybe {

  private Maybe() {
    // Utility class, no instances
  }

  /** Runs a synchronous sequence; returns None at the first absent unwrap, or the body's option. */
  @Nonnull
  public static <T> Option<T> run(@Nonnull Function<Scope, Option<T>> body) {
    return ShortCircuit.<Scope, Option<T>>run(new Scope(), body, "Maybe");
  }

  /** Runs an asynchronous sequence. The returned future completes with None or the body's option. */
  @Nonnull
  public static <T> CompletableFuture<Option<T>> runAsync(
      @Nonnull Function<Scope, ? extends CompletionStage<Option<T>>> body) {
    return ShortCircuit.<Scope, Option<T>>runAsync(new Scope(), body, "Maybe");
  }

  /** Unwrap operator handed to a {@link Maybe} body. */
  public static final class Scope {

    private Scope() {}

    /** Returns the present value, or stops the sequence if {@code option} is None. */
    @Nonnull
    public <T> T unwrap(@Nonnull Option<T> option) {
      if (option.isSome()) {
        return option.unwrap();
      }
      throw new ShortCircuit(this, None.instance());
    }

    /** Awaits {@code stage} and unwraps its option. */
    @Nonnull
    public <T> CompletableFuture<T> unwrapAsync(
        @Nonnull CompletionStage<? extends Option<T>> stage) {
      return stage.thenApply(option -> this.<T>unwrap(option)).toCompletableFuture();
    }
  }
}
