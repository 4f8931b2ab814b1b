package com.goodmem.outcome;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.goodmem.outcome.function.ThrowingSupplier;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

/**
 * Tests for the Attempt exception bridge.
 */
public class AttemptTest {

    @Test
    void testAttemptWrapsReturnValue() {
        assertEquals(Result.ok(5), Attempt.attempt(() -> 5));
    }

    @Test
    void testAttemptWrapsThrownException() {
        Result<Object, Exception> result = Attempt.attempt(() -> {
            throw new IllegalStateException("e");
        });

        assertTrue(result.isErr());
        assertInstanceOf(IllegalStateException.class, result.unwrapErr());
        assertEquals("e", result.unwrapErr().getMessage());
    }

    @Test
    void testAttemptWrapsCheckedException() {
        Result<String, Exception> result = Attempt.attempt(() -> {
            throw new IOException("disk unavailable");
        });

        assertInstanceOf(IOException.class, result.unwrapErr());
    }

    @Test
    void testAttemptAppliesErrorMapper() {
        Result<Integer, String> result = Attempt.attempt(() -> Integer.parseInt("abc"), Throwable::getMessage);

        assertEquals(Result.err("For input string: \"abc\""), result);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAttemptInvokesExactlyOnce() throws Exception {
        ThrowingSupplier<String> fn = mock(ThrowingSupplier.class);
        when(fn.get()).thenThrow(new IOException("flaky"));

        Result<String, Exception> result = Attempt.attempt(fn);

        assertTrue(result.isErr());
        verify(fn, times(1)).get();
    }

    @Test
    void testErrorsAreNotCaught() {
        assertThrows(AssertionError.class, () -> Attempt.attempt(() -> {
            throw new AssertionError("programming error");
        }));
    }

    @Test
    void testDefaultMapperWrapsNonExceptionThrowables() {
        AssertionError error = new AssertionError("not an exception");

        Exception mapped = Attempt.toException(error);

        assertInstanceOf(AttemptException.class, mapped);
        assertSame(error, mapped.getCause());
        assertEquals("java.lang.AssertionError: not an exception", mapped.getMessage());

        IOException io = new IOException("io");
        assertSame(io, Attempt.toException(io));
    }

    @Test
    void testAttemptAsyncSuccess() throws Exception {
        CompletableFuture<Result<String, Exception>> future =
                Attempt.attemptAsync(() -> CompletableFuture.supplyAsync(() -> "success"));

        assertEquals(Result.ok("success"), future.get(5, TimeUnit.SECONDS));
    }

    @Test
    void testAttemptAsyncRejection() throws Exception {
        CompletableFuture<Result<String, Exception>> future = Attempt.attemptAsync(
                () -> CompletableFuture.supplyAsync(() -> {
                    throw new IllegalArgumentException("rejected");
                }));

        Result<String, Exception> result = future.get(5, TimeUnit.SECONDS);
        assertTrue(result.isErr());
        // The CompletionException wrapper is stripped.
        assertInstanceOf(IllegalArgumentException.class, result.unwrapErr());
        assertEquals("rejected", result.unwrapErr().getMessage());
    }

    @Test
    void testAttemptAsyncWrapsNonExceptionFailure() throws Exception {
        CompletableFuture<Result<String, Exception>> future =
                Attempt.attemptAsync(() -> CompletableFuture.failedFuture(new StackOverflowError()));

        Result<String, Exception> result = future.get(5, TimeUnit.SECONDS);
        assertInstanceOf(AttemptException.class, result.unwrapErr());
        assertInstanceOf(StackOverflowError.class, result.unwrapErr().getCause());
    }

    @Test
    void testErrorsBeforeStageExistsAreNotCaught() {
        assertThrows(AssertionError.class, () -> Attempt.attemptAsync(() -> {
            throw new AssertionError("programming error");
        }));
    }

    @Test
    void testAttemptAsyncSynchronousThrow() throws Exception {
        CompletableFuture<Result<String, String>> future = Attempt.attemptAsync(
                () -> {
                    throw new IOException("connect refused");
                },
                Throwable::getMessage);

        assertTrue(future.isDone());
        assertEquals(Result.err("connect refused"), future.get());
    }

    @Test
    void testWithAttemptSupplier() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Result<Integer, Exception>> next = Attempt.withAttempt(() -> {
            if (calls.incrementAndGet() > 1) {
                throw new IllegalStateException("exhausted");
            }
            return 1;
        });

        assertEquals(Result.ok(1), next.get());
        assertInstanceOf(IllegalStateException.class, next.get().unwrapErr());
        assertEquals(2, calls.get());
    }

    @Test
    void testWithAttemptFunctionForwardsArgument() {
        Function<String, Result<Integer, Exception>> parse = Attempt.withAttempt((String s) -> Integer.parseInt(s));

        assertEquals(Result.ok(12), parse.apply("12"));
        assertInstanceOf(NumberFormatException.class, parse.apply("twelve").unwrapErr());
    }

    @Test
    void testWithAttemptBiFunctionWithMapper() {
        BiFunction<Integer, Integer, Result<Integer, String>> divide =
                Attempt.withAttempt((Integer a, Integer b) -> a / b, e -> "division failed: " + e.getMessage());

        assertEquals(Result.ok(5), divide.apply(10, 2));
        assertEquals(Result.err("division failed: / by zero"), divide.apply(1, 0));
    }

    @Test
    void testWithAttemptAsync() throws Exception {
        Function<Integer, CompletableFuture<Result<Integer, Exception>>> half =
                Attempt.withAttemptAsync((Integer n) -> n % 2 == 0
                        ? CompletableFuture.completedFuture(n / 2)
                        : CompletableFuture.failedFuture(new IllegalArgumentException("odd: " + n)));

        assertEquals(Result.ok(4), half.apply(8).get(5, TimeUnit.SECONDS));
        assertEquals("odd: 3", half.apply(3).get(5, TimeUnit.SECONDS).unwrapErr().getMessage());
    }

    @Test
    void testFromFuture() throws Exception {
        CompletableFuture<Integer> failed = new CompletableFuture<>();
        failed.completeExceptionally(new CompletionException(new IOException("socket closed")));

        Result<Integer, String> ok = Result.<Integer, String>fromFuture(
                CompletableFuture.completedFuture(1), Throwable::getMessage).get();
        Result<Integer, String> err = Result.<Integer, String>fromFuture(failed, Throwable::getMessage).get();

        assertEquals(Result.ok(1), ok);
        assertEquals(Result.err("socket closed"), err);
    }

    @Test
    void testFromThrowable() {
        Function<String, Result<Integer, String>> length = Result.fromThrowable(
                (String s) -> {
                    if (s.isEmpty()) {
                        throw new IOException("empty");
                    }
                    return s.length();
                },
                Throwable::getMessage);

        assertEquals(Result.ok(3), length.apply("abc"));
        assertEquals(Result.err("empty"), length.apply(""));
    }
}
