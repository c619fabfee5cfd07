package io.corekit.network;

import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Hook around every send performed by {@link NetworkService}.
 * <p>
 * A single interceptor serves many concurrent calls; per-call retry bookkeeping is passed in
 * as a {@link RetryState}.
 */
public interface RequestInterceptor {

    /**
     * Adapts a request before it is sent, typically by adding authentication headers.
     * Called again before every retry with the originally built request.
     *
     * @param request the request as built from the endpoint
     * @return the request to send
     */
    Request adapt(Request request);

    /**
     * Decides whether a failed attempt is repeated.
     *
     * @param request the request that was sent
     * @param response the response, if the transport delivered one with a non-success status
     * @param error the transport failure, if no response was delivered
     * @param state retry bookkeeping of the current call
     * @return the decision; the caller performs any delay it carries
     */
    CompletableFuture<RetryDecision> shouldRetry(Request request, @Nullable Response response,
                                                 @Nullable Throwable error, RetryState state);
}
