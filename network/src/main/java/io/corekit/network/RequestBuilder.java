package io.corekit.network;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an {@link Endpoint} into a concrete {@link Request}.
 * <p>
 * The endpoint path is appended to the path of the base URL with exactly one {@code /} between
 * them. Query parameters are percent-encoded and appended in order; a query already present on
 * the base URL is kept in front of them. The body is written as UTF-8 JSON.
 * <p>
 * The base URL must be absolute with a server-based authority, that is a host name made of
 * letters, digits, {@code -} and {@code .}. Registry-style authorities such as
 * {@code http://my_host:8080} have no host in {@link URI#getHost()}; the transports cannot
 * route them, so they are rejected here as {@link NetworkError.Kind#INVALID_URL}.
 */
public class RequestBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestBuilder.class);

    private final ObjectMapper objectMapper;

    public RequestBuilder() {
        this(Utils.OBJECT_MAPPER);
    }

    public RequestBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the request for an endpoint.
     *
     * @param endpoint the endpoint
     * @return the request
     * @throws NetworkError {@link NetworkError.Kind#INVALID_URL} if the endpoint has no base URL or
     *         no valid absolute URL can be formed, {@link NetworkError.Kind#ENCODING_ERROR} if the
     *         body cannot be serialized
     */
    public Request build(Endpoint endpoint) throws NetworkError {
        URI url = buildUrl(endpoint);

        String body = null;
        if (endpoint.body() != null) {
            try {
                body = objectMapper.writeValueAsString(endpoint.body());
            } catch (JsonProcessingException e) {
                LOGGER.error("Failed to serialize request body for {}: {}", endpoint.path(), e.getOriginalMessage());
                throw NetworkError.encodingError(e);
            }
        }

        Request request = new Request(endpoint.method(), url, endpoint.headers(), body, endpoint.timeout(),
                endpoint.cachePolicy(), endpoint.loggingEnabled());
        if (endpoint.loggingEnabled()) {
            logRequest(request);
        }
        return request;
    }

    private URI buildUrl(Endpoint endpoint) throws NetworkError {
        String baseUrl = endpoint.baseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            LOGGER.error("No base URL provided for endpoint {}", endpoint.path());
            throw NetworkError.invalidUrl();
        }
        try {
            URI base = new URI(baseUrl.trim());
            if (base.getScheme() == null) {
                throw new URISyntaxException(baseUrl, "Base URL must be absolute");
            }
            if (base.getHost() == null) {
                throw new URISyntaxException(baseUrl, "Base URL has no valid host name");
            }
            URI withPath = new URI(base.getScheme(), base.getAuthority(), joinPath(base.getPath(), endpoint.path()),
                    null, null);

            StringBuilder url = new StringBuilder(withPath.toASCIIString());
            String query = query(base.getRawQuery(), endpoint);
            if (!query.isEmpty()) {
                url.append('?').append(query);
            }
            return new URI(url.toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOGGER.error("Failed to build URL from base {} and path {}", baseUrl, endpoint.path());
            throw NetworkError.invalidUrl(e);
        }
    }

    static String joinPath(@Nullable String basePath, String path) {
        String head = basePath == null ? "" : basePath;
        while (head.endsWith("/")) {
            head = head.substring(0, head.length() - 1);
        }
        String tail = path;
        while (tail.startsWith("/")) {
            tail = tail.substring(1);
        }
        return tail.isEmpty() ? head + "/" : head + "/" + tail;
    }

    private static String query(@Nullable String baseQuery, Endpoint endpoint) {
        StringBuilder query = new StringBuilder(baseQuery == null ? "" : baseQuery);
        for (Endpoint.QueryParam param : endpoint.queryParams()) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(encode(param.name()));
            if (param.value() != null) {
                query.append('=').append(encode(param.value()));
            }
        }
        return query.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void logRequest(Request request) {
        if (!LOGGER.isDebugEnabled()) {
            return;
        }
        LOGGER.debug("REQUEST {} {}\nHeaders:\n{}", request.method(), request.url(), formatHeaders(request.headers()));
        if (request.body() != null) {
            LOGGER.debug("Request Body:\n{}", Utils.prettyPrint(request.body()));
        }
    }

    static String formatHeaders(Map<String, ?> headers) {
        return headers.entrySet().stream()
                .map(e -> "  " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }
}
