package io.corekit.network;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a {@link Request} and delivers the {@link Response}.
 * <p>
 * Every HTTP status completes the returned future normally. It completes exceptionally, usually
 * with an {@link io.corekit.client.http.TransportException}, only when no response was obtained.
 * Cancelling the future aborts the exchange.
 */
@FunctionalInterface
public interface Transport {

    CompletableFuture<Response> send(Request request);
}
