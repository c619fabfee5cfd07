package io.corekit.network;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpClientBuilder;
import io.corekit.client.http.HttpClientManager;
import io.corekit.client.http.HttpResponse;
import io.corekit.client.http.jdk.JdkHttpClientBuilder;
import io.corekit.util.Assert;

/**
 * {@link Transport} on top of the {@link HttpClient} abstraction, using one client per origin.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Transport jdk = new HttpClientTransport();
 * Transport vertx = new HttpClientTransport(new VertxHttpClientBuilder().vertx(vertx));
 * }</pre>
 */
public class HttpClientTransport implements Transport {

    private final HttpClientManager clientManager;

    public HttpClientTransport() {
        this(HttpClientBuilder.DEFAULT_FACTORY);
    }

    public HttpClientTransport(HttpClientBuilder clientBuilder) {
        this.clientManager = new HttpClientManager(Assert.checkNotNullParam("clientBuilder", clientBuilder));
    }

    /**
     * Creates a transport on the JDK client using the connect timeout of the configuration.
     *
     * @param configuration the configuration
     * @return the transport
     */
    public static HttpClientTransport create(NetworkConfiguration configuration) {
        return new HttpClientTransport(new JdkHttpClientBuilder().connectTimeout(configuration.timeoutInterval()));
    }

    @Override
    public CompletableFuture<Response> send(Request request) {
        URI url = request.url();
        HttpClient client = clientManager.getOrCreate(url.toString());

        String target = url.getRawPath() == null || url.getRawPath().isEmpty() ? "/" : url.getRawPath();
        if (url.getRawQuery() != null) {
            target += "?" + url.getRawQuery();
        }

        CompletableFuture<HttpResponse> exchange = client.request(request.method(), target)
                .addHeaders(request.headers())
                .body(request.body())
                .timeout(request.timeout())
                .cachePolicy(request.cachePolicy())
                .send();

        CompletableFuture<Response> result = exchange.thenCompose(response -> response.body()
                .thenApply(body -> new Response(response.statusCode(), response.headers(), body)));
        result.whenComplete((response, failure) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }
}
