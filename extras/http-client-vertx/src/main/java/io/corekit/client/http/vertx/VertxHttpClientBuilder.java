package io.corekit.client.http.vertx;

import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;

import org.jspecify.annotations.Nullable;

/**
 * Creates {@link VertxHttpClient} instances. Clients share the configured {@link Vertx}
 * instance; without one, each client gets its own.
 */
public class VertxHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new VertxHttpClient(url,
                vertx != null ? vertx : Vertx.vertx(),
                options != null ? new HttpClientOptions(options) : new HttpClientOptions());
    }
}
