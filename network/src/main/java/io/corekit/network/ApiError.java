package io.corekit.network;

import org.jspecify.annotations.Nullable;

/**
 * Error body returned by the API with a 400 status, for example
 * {@code {"code": "invalid_price", "message": "Price must be positive"}}.
 *
 * @param code machine readable error code
 * @param message human readable description
 */
public record ApiError(@Nullable String code, @Nullable String message) {
}
