package io.corekit.client.http.vertx;

import io.corekit.client.http.CachePolicy;
import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpMethod;
import io.corekit.client.http.HttpResponse;
import io.corekit.client.http.TransportException;
import io.corekit.util.Utils;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpClosedException;
import io.vertx.core.http.RequestOptions;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;

/**
 * {@link HttpClient} on a Vert.x {@link io.vertx.core.http.HttpClient} bound to one origin.
 * <p>
 * A request timeout is enforced twice: as the Vert.x idle timeout, which fails a connection
 * that stays silent, and as a deadline on the whole exchange, which also covers a response body
 * that keeps arriving too slowly. Either one fails the request with
 * {@link TransportException.Reason#TIMEOUT}.
 */
public class VertxHttpClient implements HttpClient {

    private final io.vertx.core.http.HttpClient client;

    private final Vertx vertx;

    VertxHttpClient(String baseUrl, Vertx vertx, HttpClientOptions options) {
        this.vertx = vertx;
        this.client = initClient(baseUrl, options);
    }

    private io.vertx.core.http.HttpClient initClient(String baseUrl, HttpClientOptions options) {
        URL targetUrl = buildUrl(baseUrl);

        return this.vertx.createHttpClient(options
                .setDefaultHost(targetUrl.getHost())
                .setDefaultPort(targetUrl.getPort() != -1 ? targetUrl.getPort() : targetUrl.getDefaultPort())
                .setSsl(isSecureProtocol(targetUrl.getProtocol())));
    }

    @Override
    public RequestBuilder request(HttpMethod method, String path) {
        return new VertxRequestBuilder(method, path);
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    private static boolean isSecureProtocol(String protocol) {
        return protocol.charAt(protocol.length() - 1) == 's' && protocol.length() > 2;
    }

    static Throwable translate(Throwable failure) {
        Throwable cause = Utils.unwrapCompletionException(failure);
        if (cause instanceof HttpClosedException) {
            return new TransportException(TransportException.Reason.CONNECTION_LOST, cause.getMessage(), cause);
        }
        return TransportException.translate(cause);
    }

    private class VertxRequestBuilder implements RequestBuilder {
        private final HttpMethod method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable String body;
        private @Nullable Duration timeout;
        private CachePolicy cachePolicy = CachePolicy.USE_PROTOCOL_CACHE_POLICY;

        VertxRequestBuilder(HttpMethod method, String path) {
            this.method = method;
            this.path = path;
        }

        @Override
        public RequestBuilder addHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        @Override
        public RequestBuilder addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        @Override
        public RequestBuilder body(@Nullable String body) {
            this.body = body;
            return this;
        }

        @Override
        public RequestBuilder timeout(@Nullable Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        @Override
        public RequestBuilder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = cachePolicy;
            return this;
        }

        private RequestOptions requestOptions() {
            RequestOptions options = new RequestOptions()
                    .setMethod(io.vertx.core.http.HttpMethod.valueOf(method.name()))
                    .setURI(path);
            if (timeout != null) {
                options.setIdleTimeout(Math.max(1L, timeout.toMillis()));
            }
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                options.putHeader(entry.getKey(), entry.getValue());
            }
            String cacheControl = cachePolicy.cacheControl();
            if (cacheControl != null
                    && (options.getHeaders() == null || !options.getHeaders().contains(CachePolicy.CACHE_CONTROL))) {
                options.putHeader(CachePolicy.CACHE_CONTROL, cacheControl);
            }
            return options;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            AtomicReference<HttpClientRequest> inFlight = new AtomicReference<>();
            CompletableFuture<HttpResponse> result = new CompletableFuture<>();

            // the idle timeout alone does not fire while a slow body keeps trickling in
            long deadline = timeout == null ? -1L : vertx.setTimer(Math.max(1L, timeout.toMillis()), id ->
                    result.completeExceptionally(new TransportException(TransportException.Reason.TIMEOUT,
                            "Request did not complete within " + timeout)));

            Future<HttpResponse> exchange = client.request(requestOptions())
                    .compose(request -> {
                        inFlight.set(request);
                        return body == null ? request.send() : request.send(body);
                    })
                    .compose(this::buffer);

            exchange.onComplete(ar -> {
                if (ar.succeeded()) {
                    result.complete(ar.result());
                } else {
                    result.completeExceptionally(translate(ar.cause()));
                }
            });
            result.whenComplete((response, failure) -> {
                if (deadline >= 0) {
                    vertx.cancelTimer(deadline);
                }
                HttpClientRequest request = inFlight.get();
                if (failure != null && request != null && !exchange.isComplete()) {
                    request.reset();
                }
            });
            return result;
        }

        private Future<HttpResponse> buffer(HttpClientResponse response) {
            return response.body().map(buffer -> new VertxHttpResponse(
                    response.statusCode(), toMap(response.headers()), buffer.toString()));
        }
    }

    private static Map<String, List<String>> toMap(MultiMap headers) {
        Map<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : headers.names()) {
            map.put(name, new ArrayList<>(headers.getAll(name)));
        }
        return map;
    }

    private record VertxHttpResponse(int statusCode, Map<String, List<String>> headers, String content)
            implements HttpResponse {

        @Override
        public CompletableFuture<String> body() {
            return CompletableFuture.completedFuture(content);
        }
    }
}
