package io.corekit.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * HTTP client bound to one origin ({@code scheme://host:port}).
 * <p>
 * Every status code, including 4xx and 5xx, completes the future returned by
 * {@link RequestBuilder#send()} normally; classifying statuses is left to the caller. The future
 * completes exceptionally with a {@link TransportException} when no response could be obtained,
 * and cancelling it aborts the exchange.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://api.example.com");
 *
 * HttpResponse response = client.post("/v1/products?dry_run=true")
 *     .addHeader("Content-Type", "application/json")
 *     .timeout(Duration.ofSeconds(10))
 *     .body("{\"name\":\"Widget\"}")
 *     .send()
 *     .get();
 * }</pre>
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    /**
     * Creates a request builder.
     *
     * @param method the HTTP method
     * @param path the raw (already encoded) path, optionally followed by {@code ?query}
     * @return a new builder
     */
    RequestBuilder request(HttpMethod method, String path);

    default RequestBuilder get(String path) {
        return request(HttpMethod.GET, path);
    }

    default RequestBuilder post(String path) {
        return request(HttpMethod.POST, path);
    }

    default RequestBuilder put(String path) {
        return request(HttpMethod.PUT, path);
    }

    default RequestBuilder patch(String path) {
        return request(HttpMethod.PATCH, path);
    }

    default RequestBuilder delete(String path) {
        return request(HttpMethod.DELETE, path);
    }

    interface RequestBuilder {
        CompletableFuture<HttpResponse> send();

        RequestBuilder addHeader(String name, String value);

        RequestBuilder addHeaders(@Nullable Map<String, String> headers);

        RequestBuilder body(@Nullable String body);

        /**
         * Sets how long to wait for the response. {@code null} waits indefinitely.
         *
         * @param timeout the timeout
         * @return this builder
         */
        RequestBuilder timeout(@Nullable Duration timeout);

        RequestBuilder cachePolicy(CachePolicy cachePolicy);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
