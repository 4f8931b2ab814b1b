package com.goodmem.outcome.function;

/** A function that may throw a checked exception. */
@FunctionalInterface
public interface ThrowingFunction<A, R> {
  R apply(A a) throws Exception;
}
