package io.corekit.network;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.corekit.client.http.CachePolicy;
import io.corekit.client.http.HttpMethod;
import io.corekit.json.JsonValue;
import io.corekit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Description of one API operation: where to send it, how, and with what.
 * <p>
 * Endpoints are values created per call. Only the path is required; every other property has a
 * default:
 * <ul>
 *   <li>method {@code GET}</li>
 *   <li>timeout 60 seconds</li>
 *   <li>cache policy {@link CachePolicy#RELOAD_IGNORING_LOCAL_AND_REMOTE_CACHE_DATA}</li>
 *   <li>retry limit 3</li>
 *   <li>logging enabled</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Endpoint endpoint = Endpoint.builder()
 *     .baseUrl("https://api.example.com/v1")
 *     .path("products")
 *     .method(HttpMethod.POST)
 *     .body(JsonValue.object().put("name", "Widget").put("price", 9.99).build())
 *     .build();
 * }</pre>
 *
 * @param baseUrl absolute base URL; a call without one fails with {@link NetworkError.Kind#INVALID_URL}
 * @param path path appended to the base URL
 * @param method the HTTP method
 * @param headers additional request headers
 * @param queryParams query parameters, in order
 * @param body JSON request body, or {@code null} for none
 * @param timeout how long to wait for each response
 * @param cachePolicy cache directive for the transport
 * @param retryLimit maximum number of retries of transient failures
 * @param loggingEnabled whether request and response traffic is logged
 */
public record Endpoint(@Nullable String baseUrl, String path, HttpMethod method, Map<String, String> headers,
                       List<QueryParam> queryParams, @Nullable JsonValue body, Duration timeout,
                       CachePolicy cachePolicy, int retryLimit, boolean loggingEnabled) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final CachePolicy DEFAULT_CACHE_POLICY = CachePolicy.RELOAD_IGNORING_LOCAL_AND_REMOTE_CACHE_DATA;
    public static final int DEFAULT_RETRY_LIMIT = 3;

    public Endpoint {
        Assert.checkNotNullParam("path", path);
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("timeout", timeout);
        Assert.checkNotNullParam("cachePolicy", cachePolicy);
        Assert.checkMinimumParameter("retryLimit", retryLimit);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(Assert.checkNotNullParam("headers", headers)));
        queryParams = List.copyOf(Assert.checkNotNullParam("queryParams", queryParams));
    }

    /**
     * A query parameter. The value may be {@code null}, producing {@code ?name} without {@code =}.
     *
     * @param name the parameter name
     * @param value the parameter value
     */
    public record QueryParam(String name, @Nullable String value) {
        public QueryParam {
            Assert.checkNotNullParam("name", name);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder().method(method).path(path);
    }

    /**
     * Returns a builder initialised with the properties of this endpoint.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .baseUrl(baseUrl)
                .path(path)
                .method(method)
                .headers(headers)
                .body(body)
                .timeout(timeout)
                .cachePolicy(cachePolicy)
                .retryLimit(retryLimit)
                .loggingEnabled(loggingEnabled);
        builder.queryParams.addAll(queryParams);
        return builder;
    }

    public static class Builder {
        private @Nullable String baseUrl;
        private @Nullable String path;
        private HttpMethod method = HttpMethod.GET;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final List<QueryParam> queryParams = new ArrayList<>();
        private @Nullable JsonValue body;
        private Duration timeout = DEFAULT_TIMEOUT;
        private CachePolicy cachePolicy = DEFAULT_CACHE_POLICY;
        private int retryLimit = DEFAULT_RETRY_LIMIT;
        private boolean loggingEnabled = true;

        private Builder() {
        }

        public Builder baseUrl(@Nullable String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(HttpMethod method) {
            this.method = Assert.checkNotNullParam("method", method);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Assert.checkNotNullParam("name", name), Assert.checkNotNullParam("value", value));
            return this;
        }

        public Builder headers(@Nullable Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder queryParam(String name, @Nullable String value) {
            queryParams.add(new QueryParam(name, value));
            return this;
        }

        public Builder body(@Nullable JsonValue body) {
            this.body = body;
            return this;
        }

        /**
         * Sets the body from a plain map, see {@link JsonValue#of(Object)} for the supported values.
         *
         * @param body the body members
         * @return this builder
         * @throws IllegalArgumentException if a value has no JSON representation
         */
        public Builder body(Map<String, ?> body) {
            this.body = JsonValue.of(body);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Assert.checkNotNullParam("timeout", timeout);
            return this;
        }

        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = Assert.checkNotNullParam("cachePolicy", cachePolicy);
            return this;
        }

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder loggingEnabled(boolean loggingEnabled) {
            this.loggingEnabled = loggingEnabled;
            return this;
        }

        public Endpoint build() {
            return new Endpoint(baseUrl, Assert.checkNotNullParam("path", path), method, headers, queryParams,
                    body, timeout, cachePolicy, retryLimit, loggingEnabled);
        }
    }
}
