package io.corekit.client.http.jdk;

import io.corekit.client.http.CachePolicy;
import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpMethod;
import io.corekit.client.http.HttpResponse;
import io.corekit.client.http.TransportException;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build());
    }

    JdkHttpClient(String baseUrl, java.net.http.HttpClient httpClient) {
        this.httpClient = httpClient;

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
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

    @Override
    public RequestBuilder request(HttpMethod method, String path) {
        return new JdkRequestBuilder(method, path);
    }

    private class JdkRequestBuilder implements RequestBuilder {
        private final HttpMethod method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable String body;
        private @Nullable Duration timeout;
        private CachePolicy cachePolicy = CachePolicy.USE_PROTOCOL_CACHE_POLICY;

        JdkRequestBuilder(HttpMethod method, String path) {
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

        private HttpRequest createRequest() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .method(method.name(), body == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            String cacheControl = cachePolicy.cacheControl();
            if (cacheControl != null && !hasHeader(CachePolicy.CACHE_CONTROL)) {
                builder.header(CachePolicy.CACHE_CONTROL, cacheControl);
            }
            return builder.build();
        }

        private boolean hasHeader(String name) {
            for (String key : headers.keySet()) {
                if (key.equalsIgnoreCase(name)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request;
            try {
                request = createRequest();
            } catch (IllegalArgumentException e) {
                return CompletableFuture.failedFuture(
                        new TransportException(TransportException.Reason.OTHER, e.getMessage(), e));
            }

            CompletableFuture<java.net.http.HttpResponse<String>> exchange =
                    httpClient.sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            CompletableFuture<HttpResponse> result = exchange
                    .<HttpResponse>thenApply(JdkHttpResponse::new)
                    .exceptionallyCompose(t -> CompletableFuture.failedFuture(TransportException.translate(t)));
            result.whenComplete((response, failure) -> {
                if (result.isCancelled()) {
                    exchange.cancel(true);
                }
            });
            return result;
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public CompletableFuture<String> body() {
            String body = response.body();
            return CompletableFuture.completedFuture(body == null ? "" : body);
        }
    }
}
