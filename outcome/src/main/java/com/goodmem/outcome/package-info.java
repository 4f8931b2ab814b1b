/**
 * Value types for fallible and optional results, and the utilities that compose them.
 *
 * <p>This package provides a consistent way to represent failure and absence without relying on
 * exceptions or null checks for control flow. The central types are:
 *
 * <ul>
 *   <li>{@link com.goodmem.outcome.Option} - a present ({@link com.goodmem.outcome.Some}) or
 *       absent ({@link com.goodmem.outcome.None}) value
 *   <li>{@link com.goodmem.outcome.Result} - a success ({@link com.goodmem.outcome.Ok}) or an
 *       error ({@link com.goodmem.outcome.Err})
 *   <li>{@link com.goodmem.outcome.Attempt} - turns throwing calls into results
 *   <li>{@link com.goodmem.outcome.Try} and {@link com.goodmem.outcome.Maybe} - sequences that
 *       return early at the first failure
 * </ul>
 *
 * <p>Only two exceptions are thrown by this package, {@link com.goodmem.outcome.OptionException}
 * and {@link com.goodmem.outcome.ResultException}, and only when a value is demanded from the
 * wrong variant.
 *
 * <p>Example usage:
 *
 * <pre>
 * // Method that returns either a port number or a parse error
 * public Result&lt;Integer, Status&gt; parsePort(String raw) {
 *     return Attempt.attempt(() -&gt; Integer.parseInt(raw), Status::fromThrowable)
 *         .andThen(port -&gt; port &gt; 0 &amp;&amp; port &lt; 65536
 *             ? Result.ok(port)
 *             : Result.err(Status.invalidArgument("Port out of range: " + port)));
 * }
 *
 * // Composing several fallible steps
 * Result&lt;Endpoint, Status&gt; endpoint = Try.run(scope -&gt; {
 *     String host = scope.unwrap(readHost());
 *     int port = scope.unwrap(parsePort(rawPort));
 *     return Result.ok(new Endpoint(host, port));
 * });
 *
 * String message = endpoint.match(
 *     e -&gt; "Connecting to " + e,
 *     status -&gt; "Bad endpoint: " + status);
 * </pre>
 */
package com.goodmem.outcome;
