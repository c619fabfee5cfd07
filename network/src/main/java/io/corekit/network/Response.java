package io.corekit.network;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import io.corekit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * An HTTP response as delivered by a {@link Transport}, with its body fully read.
 *
 * @param statusCode the HTTP status
 * @param headers response headers, names compared case-insensitively
 * @param body the body text, empty when the response has none
 */
public record Response(int statusCode, Map<String, List<String>> headers, String body) {

    public Response {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(Assert.checkNotNullParam("headers", headers));
        headers = Collections.unmodifiableMap(copy);
        Assert.checkNotNullParam("body", body);
    }

    public Response(int statusCode, String body) {
        this(statusCode, Map.of(), body);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public @Nullable String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
