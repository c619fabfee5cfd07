package io.corekit.network;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import io.corekit.client.http.TransportException;
import io.corekit.network.session.NetworkSession;
import io.corekit.util.Assert;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds JSON and bearer authentication headers, retries transient failures and renews expired
 * access tokens.
 *
 * <h2>Retry Rules</h2>
 * Evaluated in order, the first match wins:
 * <ol>
 *   <li>retry budget exhausted - no retry</li>
 *   <li>status 401 - token refresh, then one immediate retry; without a refresh token, or when
 *       the refresh fails, the session is cleared and the call is not retried</li>
 *   <li>status 408, 500, 502, 503 or 504 - retry after the configured delay</li>
 *   <li>any other status - no retry</li>
 *   <li>transport timeout, no connectivity or lost connection - retry after the configured delay</li>
 *   <li>any other failure - no retry</li>
 * </ol>
 * The refresh retry is budgeted separately from the transient retries and happens at most once
 * per call.
 */
public class DefaultRequestInterceptor implements RequestInterceptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestInterceptor.class);

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String AUTHORIZATION = "Authorization";
    public static final String APPLICATION_JSON = "application/json";
    private static final String BEARER_PREFIX = "Bearer ";

    private static final Set<Integer> RETRIABLE_STATUSES = Set.of(408, 500, 502, 503, 504);

    private final NetworkSession session;
    private final Duration retryDelay;

    public DefaultRequestInterceptor(NetworkSession session) {
        this(session, NetworkConfiguration.DEFAULT_RETRY_DELAY);
    }

    public DefaultRequestInterceptor(NetworkSession session, Duration retryDelay) {
        this.session = Assert.checkNotNullParam("session", session);
        this.retryDelay = Assert.checkNotNullParam("retryDelay", retryDelay);
    }

    public NetworkSession getSession() {
        return session;
    }

    @Override
    public Request adapt(Request request) {
        Request adapted = request.withHeader(CONTENT_TYPE, APPLICATION_JSON);
        String accessToken = session.accessToken();
        if (accessToken != null) {
            adapted = adapted.withHeader(AUTHORIZATION, BEARER_PREFIX + accessToken);
        }
        return adapted;
    }

    @Override
    public CompletableFuture<RetryDecision> shouldRetry(Request request, @Nullable Response response,
                                                        @Nullable Throwable error, RetryState state) {
        if (state.isExhausted()) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }

        if (response != null) {
            int status = response.statusCode();
            if (status == 401) {
                return refreshAndRetry(request, state);
            }
            if (RETRIABLE_STATUSES.contains(status)) {
                return retryLater(state);
            }
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }

        if (error != null && Utils.unwrapCompletionException(error) instanceof TransportException transportError
                && transportError.isTransient()) {
            return retryLater(state);
        }
        return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
    }

    private CompletableFuture<RetryDecision> retryLater(RetryState state) {
        state.increment();
        return CompletableFuture.completedFuture(RetryDecision.retryAfter(retryDelay));
    }

    private CompletableFuture<RetryDecision> refreshAndRetry(Request request, RetryState state) {
        if (!state.tryConsumeRefresh()) {
            LOGGER.debug("Request to {} unauthorized again after token refresh", request.url());
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }

        // another call may already have replaced the token this request was sent with
        String currentToken = session.accessToken();
        if (currentToken != null && !(BEARER_PREFIX + currentToken).equals(request.header(AUTHORIZATION))) {
            LOGGER.debug("Retrying {} with the current access token", request.url());
            return CompletableFuture.completedFuture(RetryDecision.RETRY_NOW);
        }

        if (session.refreshToken() == null) {
            LOGGER.debug("No refresh token available, clearing session");
            session.clearTokens();
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }

        return session.refreshAccessToken()
                .handle((accessToken, failure) -> failure == null
                        ? RetryDecision.RETRY_NOW
                        : RetryDecision.DO_NOT_RETRY);
    }
}
