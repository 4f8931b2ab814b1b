package com.goodmem.outcome.function;

/** A supplier that may throw a checked exception. */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Exception;
}
