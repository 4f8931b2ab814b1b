package com.goodmem.outcome.function;

/** A two-argument function that may throw a checked exception. */
@FunctionalInterface
public interface ThrowingBiFunction<A, B, R> {
  R apply(A a, B b) throws Exception;
}
