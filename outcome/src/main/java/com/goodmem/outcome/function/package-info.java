/**
 * Functional interfaces whose single method may throw a checked exception. They are the input
 * shapes accepted by {@link com.goodmem.outcome.Attempt}.
 */
package com.goodmem.outcome.function;
