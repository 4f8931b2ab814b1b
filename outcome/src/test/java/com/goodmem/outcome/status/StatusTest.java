package com.goodmem.outcome.status;

import com.goodmem.outcome.Attempt;
import com.goodmem.outcome.Result;
import java.io.IOException;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Status and its conversion into Result.
 */
public class StatusTest {

    @Test
    void testStatusCreation() {
        Status ok = Status.ok();
        assertTrue(ok.isOk());
        assertFalse(ok.isError());
        assertEquals(StatusCode.OK, ok.getCode());
        assertNull(ok.getMessage());

        Status notFound = Status.notFound("Item not found");
        assertFalse(notFound.isOk());
        assertTrue(notFound.isError());
        assertEquals(StatusCode.NOT_FOUND, notFound.getCode());
        assertEquals("Item not found", notFound.getMessage());

        Exception exception = new RuntimeException("Test exception");
        Status internal = Status.internal("Internal error", exception);
        assertTrue(internal.isError());
        assertEquals(StatusCode.INTERNAL, internal.getCode());
        assertEquals("Internal error", internal.getMessage());
        assertEquals(exception, internal.getCause());
    }

    @Test
    void testStatusRequiresCode() {
        assertThrows(NullPointerException.class, () -> Status.of(null, "no code"));
    }

    @Test
    void testToString() {
        assertEquals("OK", Status.ok().toString());
        assertEquals("INVALID_ARGUMENT: bad port", Status.invalidArgument("bad port").toString());
    }

    @Test
    void testFromThrowable() {
        assertEquals(StatusCode.INVALID_ARGUMENT, Status.fromThrowable(new NumberFormatException("x")).getCode());
        assertEquals(StatusCode.NOT_FOUND, Status.fromThrowable(new NoSuchElementException("x")).getCode());
        assertEquals(StatusCode.FAILED_PRECONDITION, Status.fromThrowable(new IllegalStateException("x")).getCode());
        assertEquals(StatusCode.UNIMPLEMENTED, Status.fromThrowable(new UnsupportedOperationException("x")).getCode());
        assertEquals(StatusCode.DEADLINE_EXCEEDED, Status.fromThrowable(new TimeoutException("x")).getCode());
        assertEquals(StatusCode.CANCELLED, Status.fromThrowable(new CancellationException("x")).getCode());
    }

    @Test
    void testFromThrowableFallsBackToInternal() {
        IOException exception = new IOException("Test exception");
        Status status = Status.fromThrowable(exception);

        assertEquals(StatusCode.INTERNAL, status.getCode());
        assertTrue(status.getMessage().contains("Test exception"));
        assertSame(exception, status.getCause());
    }

    @Test
    void testIntoResult() {
        assertEquals(Result.ok(null), Result.from(Status.ok()));

        Status error = Status.failedPrecondition("not ready");
        Result<Void, Status> result = Result.from(error);
        assertTrue(result.isErr());
        assertSame(error, result.unwrapErr());
    }

    @Test
    void testToResult() {
        assertEquals(Result.ok("payload"), Status.ok().toResult("payload"));

        Status error = Status.unimplemented("later");
        assertEquals(Result.err(error), error.toResult("payload"));
    }

    @Test
    void testUsedAsAttemptMapper() {
        Result<Integer, Status> port = Attempt.attempt(() -> Integer.parseInt("http"), Status::fromThrowable);

        assertEquals(StatusCode.INVALID_ARGUMENT, port.unwrapErr().getCode());
        assertInstanceOf(NumberFormatException.class, port.unwrapErr().getCause());
        assertEquals(Result.ok(8080), Attempt.attempt(() -> Integer.parseInt("8080"), Status::fromThrowable));
    }

    @Test
    void testEquality() {
        assertEquals(Status.notFound("x"), Status.notFound("x"));
        assertEquals(Status.notFound("x").hashCode(), Status.notFound("x").hashCode());
        assertNotEquals(Status.notFound("x"), Status.invalidArgument("x"));
    }
}
