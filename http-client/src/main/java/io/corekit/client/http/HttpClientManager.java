package io.corekit.client.http;

import io.corekit.util.Assert;

import java.net.URI;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out one {@link HttpClient} per origin so that requests to the same scheme, host and
 * port share the client and its connection pool. A missing port is the scheme's default, so
 * {@code https://host} and {@code https://host:443} resolve to the same client.
 */
public class HttpClientManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientManager.class);

    private final Map<Origin, HttpClient> clients = new ConcurrentHashMap<>();
    private final HttpClientBuilder clientBuilder;

    public HttpClientManager() {
        this(HttpClientBuilder.DEFAULT_FACTORY);
    }

    public HttpClientManager(HttpClientBuilder clientBuilder) {
        this.clientBuilder = Assert.checkNotNullParam("clientBuilder", clientBuilder);
    }

    /**
     * Returns the client for the origin of {@code url}, creating it on first use.
     *
     * @param url an absolute URL; only its origin is significant
     * @return the shared client
     * @throws IllegalArgumentException if the URL is null or malformed
     */
    public HttpClient getOrCreate(String url) {
        Assert.checkNotNullParam("url", url);

        final Origin origin;
        try {
            origin = Origin.from(URI.create(url).toURL());
        } catch (Exception ex) {
            throw new IllegalArgumentException("URL is malformed: [" + url + "]", ex);
        }
        return clients.computeIfAbsent(origin, key -> {
            LOGGER.debug("Creating HTTP client for {}://{}:{}", key.scheme(), key.host(), key.port());
            return clientBuilder.create(url);
        });
    }

    private record Origin(String scheme, String host, int port) {
        static Origin from(URL url) {
            return new Origin(url.getProtocol(), url.getHost(),
                    url.getPort() != -1 ? url.getPort() : url.getDefaultPort());
        }
    }
}
