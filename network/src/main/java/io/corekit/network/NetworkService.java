package io.corekit.network;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.corekit.util.Assert;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes {@link Endpoint}s: builds the request, adapts it through the
 * {@link RequestInterceptor}, sends it through the {@link Transport} with bounded retries,
 * validates the response and decodes its body.
 * <p>
 * Each call is independent; the only state shared between calls is the session held by the
 * interceptor. Every failure reaches the caller as a {@link NetworkError}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * NetworkService service = NetworkService.builder()
 *     .session(session)
 *     .build();
 *
 * List<Product> products = service.execute(
 *         Endpoint.builder(HttpMethod.GET, "products").baseUrl("https://api.example.com").build(),
 *         new TypeReference<List<Product>>() {})
 *     .get();
 * }</pre>
 *
 * <h2>Retries</h2>
 * The number of retries of transient failures is bounded by the smaller of
 * {@link Endpoint#retryLimit()} and {@link NetworkConfiguration#retryLimit()}; a call that
 * triggers a token refresh may send one more request. Build failures and decoding failures are
 * never retried.
 */
public class NetworkService {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkService.class);

    private final Transport transport;
    private final RequestInterceptor interceptor;
    private final ResponseValidator validator;
    private final NetworkConfiguration configuration;
    private final RequestBuilder requestBuilder;
    private final ObjectMapper objectMapper;

    NetworkService(Transport transport, RequestInterceptor interceptor, ResponseValidator validator,
                   NetworkConfiguration configuration, RequestBuilder requestBuilder, ObjectMapper objectMapper) {
        this.transport = Assert.checkNotNullParam("transport", transport);
        this.interceptor = Assert.checkNotNullParam("interceptor", interceptor);
        this.validator = Assert.checkNotNullParam("validator", validator);
        this.configuration = Assert.checkNotNullParam("configuration", configuration);
        this.requestBuilder = Assert.checkNotNullParam("requestBuilder", requestBuilder);
        this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
    }

    public static NetworkServiceBuilder builder() {
        return new NetworkServiceBuilder();
    }

    public NetworkConfiguration getConfiguration() {
        return configuration;
    }

    public RequestInterceptor getInterceptor() {
        return interceptor;
    }

    /**
     * Executes an endpoint and decodes the response body.
     *
     * @param endpoint the endpoint
     * @param type the type to decode the body into
     * @param <T> the decoded type
     * @return the pending call
     */
    public <T> NetworkCall<T> execute(Endpoint endpoint, Class<T> type) {
        Assert.checkNotNullParam("type", type);
        return execute(endpoint, objectMapper.constructType(type));
    }

    /**
     * Executes an endpoint and decodes the response body into a generic type.
     *
     * @param endpoint the endpoint
     * @param type the type to decode the body into, for example {@code new TypeReference<List<Product>>() {}}
     * @param <T> the decoded type
     * @return the pending call
     */
    public <T> NetworkCall<T> execute(Endpoint endpoint, TypeReference<T> type) {
        Assert.checkNotNullParam("type", type);
        return execute(endpoint, objectMapper.constructType(type));
    }

    /**
     * Executes an endpoint whose response body is of no interest.
     *
     * @param endpoint the endpoint
     * @return the pending call, completing with {@code null} on success
     */
    public NetworkCall<Void> execute(Endpoint endpoint) {
        return execute(endpoint, (JavaType) null);
    }

    private <T> NetworkCall<T> execute(Endpoint endpoint, @Nullable JavaType type) {
        Assert.checkNotNullParam("endpoint", endpoint);
        NetworkCall<T> call = new NetworkCall<>();

        final Request request;
        try {
            request = requestBuilder.build(endpoint);
        } catch (NetworkError e) {
            LOGGER.error("Failed to build request for {} {}: {}", endpoint.method(), endpoint.path(), e.getMessage());
            call.completeExceptionally(e);
            return call;
        }

        Duration callTimeout = configuration.callTimeout();
        if (callTimeout != null) {
            CompletableFuture.delayedExecutor(callTimeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (call.abort(NetworkError.networkFailure(
                        new TimeoutException("Call did not complete within " + callTimeout)))) {
                    LOGGER.error("Request {} {} timed out after {}", request.method(), request.url(), callTimeout);
                }
            });
        }

        RetryState state = new RetryState(Math.min(endpoint.retryLimit(), configuration.retryLimit()));
        new Execution<>(call, request, state, type).send();
        return call;
    }

    /**
     * The send loop of one call.
     */
    private final class Execution<T> {
        private final NetworkCall<T> call;
        private final Request request;
        private final RetryState state;
        private final @Nullable JavaType type;
        private int sends;
        private @Nullable Response lastResponse;
        private @Nullable NetworkError lastError;

        Execution(NetworkCall<T> call, Request request, RetryState state, @Nullable JavaType type) {
            this.call = call;
            this.request = request;
            this.state = state;
            this.type = type;
        }

        /**
         * The initial send plus the transient retries, and one more once a token refresh happened.
         */
        private int maxSends() {
            return state.limit() + 1 + (state.isRefreshUsed() ? 1 : 0);
        }

        void send() {
            if (call.isDone()) {
                return;
            }
            if (sends >= maxSends()) {
                LOGGER.debug("Stopping {} {} after {} attempts", request.method(), request.url(), sends);
                conclude(lastResponse);
                return;
            }
            sends++;

            final Request adapted;
            CompletableFuture<Response> exchange;
            try {
                adapted = interceptor.adapt(request);
                exchange = transport.send(adapted);
            } catch (RuntimeException e) {
                fail(NetworkError.networkFailure(e));
                return;
            }
            call.track(exchange);
            exchange.whenComplete((response, failure) -> {
                if (call.isDone()) {
                    return;
                }
                if (failure != null) {
                    onFailure(adapted, failure);
                } else {
                    onResponse(adapted, response);
                }
            });
        }

        private void onResponse(Request adapted, Response response) {
            lastResponse = response;
            lastError = null;
            if (adapted.loggingEnabled()) {
                logResponse(adapted, response);
            }
            if (response.isSuccessful()) {
                finish(response);
                return;
            }
            LOGGER.debug("Attempt {} to {} answered with status {}", sends, adapted.url(), response.statusCode());
            decide(adapted, response, null);
        }

        private void onFailure(Request adapted, Throwable failure) {
            Throwable cause = Utils.unwrapCompletionException(failure);
            lastResponse = null;
            lastError = toNetworkError(cause);
            LOGGER.debug("Attempt {} to {} failed: {}", sends, adapted.url(), cause.toString());
            if (lastError.getKind() == NetworkError.Kind.CANCELLED) {
                fail(lastError);
                return;
            }
            decide(adapted, null, cause);
        }

        private void decide(Request adapted, @Nullable Response response, @Nullable Throwable cause) {
            CompletableFuture<RetryDecision> decision;
            try {
                decision = interceptor.shouldRetry(adapted, response, cause, state);
            } catch (RuntimeException e) {
                decision = CompletableFuture.failedFuture(e);
            }
            call.track(decision);
            decision.whenComplete((retry, failure) -> {
                if (call.isDone()) {
                    return;
                }
                if (failure != null) {
                    LOGGER.warn("Retry decision for {} failed, not retrying", adapted.url(),
                            Utils.unwrapCompletionException(failure));
                    conclude(response);
                } else if (retry.retry()) {
                    LOGGER.warn("Retrying {} {} (retry {}/{}) in {} ms{}", adapted.method(), adapted.url(),
                            state.attempts(), state.limit(), retry.delay().toMillis(),
                            response != null ? " after status " + response.statusCode() : "");
                    retryAfter(retry.delay());
                } else {
                    conclude(response);
                }
            });
        }

        private void retryAfter(Duration delay) {
            if (delay.isZero()) {
                send();
                return;
            }
            CompletableFuture<Void> backoff = new CompletableFuture<>();
            call.track(backoff);
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
                    .execute(() -> backoff.complete(null));
            backoff.thenRun(this::send);
        }

        private void conclude(@Nullable Response response) {
            if (response != null) {
                finish(response);
            } else {
                fail(lastError != null ? lastError
                        : NetworkError.networkFailure(new IOException("No response received")));
            }
        }

        private void finish(Response response) {
            try {
                validator.validate(response.body(), response);
                call.complete(decode(response.body()));
            } catch (NetworkError e) {
                lastError = e;
                fail(e);
            } catch (RuntimeException e) {
                fail(NetworkError.networkFailure(e));
            }
        }

        @SuppressWarnings("unchecked")
        private @Nullable T decode(String body) throws NetworkError {
            if (type == null) {
                return null;
            }
            if (body.isBlank()) {
                throw NetworkError.noData();
            }
            try {
                return (T) objectMapper.readValue(body, type);
            } catch (IOException e) {
                LOGGER.error("Decoding failed for type {}", type, e);
                throw NetworkError.decodingError(e);
            }
        }

        private void fail(NetworkError error) {
            if (call.completeExceptionally(error)) {
                LOGGER.error("Network request {} {} failed: {}", request.method(), request.url(), error.getMessage());
            }
        }
    }

    static NetworkError toNetworkError(Throwable failure) {
        Throwable cause = Utils.unwrapCompletionException(failure);
        if (cause instanceof NetworkError networkError) {
            return networkError;
        }
        if (cause instanceof CancellationException) {
            return NetworkError.cancelled();
        }
        return NetworkError.networkFailure(cause);
    }

    private static void logResponse(Request request, Response response) {
        if (!LOGGER.isDebugEnabled()) {
            return;
        }
        LOGGER.debug("RESPONSE [{}] {}\nHeaders:\n{}", response.statusCode(), request.url(),
                RequestBuilder.formatHeaders(response.headers()));
        if (!response.body().isEmpty()) {
            LOGGER.debug("Response Data:\n{}", Utils.prettyPrint(response.body()));
        }
    }
}
