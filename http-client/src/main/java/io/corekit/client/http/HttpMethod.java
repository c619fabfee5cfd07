package io.corekit.client.http;

/**
 * HTTP methods supported by the transports.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE
}
