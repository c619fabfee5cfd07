package io.corekit.network;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import io.corekit.client.http.CachePolicy;
import io.corekit.client.http.HttpMethod;
import io.corekit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A concrete HTTP request built from an {@link Endpoint}.
 * <p>
 * Requests are immutable; {@link #withHeader(String, String)} returns a copy. Header names are
 * compared case-insensitively, so setting {@code authorization} replaces {@code Authorization}.
 *
 * @param method the HTTP method
 * @param url the absolute URL including the query string
 * @param headers request headers
 * @param body the UTF-8 JSON payload, or {@code null} for none
 * @param timeout how long to wait for the response
 * @param cachePolicy cache directive passed to the transport
 * @param loggingEnabled whether traffic of this request is logged
 */
public record Request(HttpMethod method, URI url, Map<String, String> headers, @Nullable String body,
                      Duration timeout, CachePolicy cachePolicy, boolean loggingEnabled) {

    public Request {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("url", url);
        Assert.checkNotNullParam("timeout", timeout);
        Assert.checkNotNullParam("cachePolicy", cachePolicy);
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(Assert.checkNotNullParam("headers", headers));
        headers = Collections.unmodifiableMap(copy);
    }

    public Request withHeader(String name, String value) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.put(name, value);
        return new Request(method, url, copy, body, timeout, cachePolicy, loggingEnabled);
    }

    public @Nullable String header(String name) {
        return headers.get(name);
    }
}
