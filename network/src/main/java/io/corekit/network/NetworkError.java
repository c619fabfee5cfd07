package io.corekit.network;

import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Failure of a network call.
 * <p>
 * Every failure reaching the caller of {@link NetworkService} is one of the {@link Kind}s below.
 * Transport failures, Jackson failures and cancellation are wrapped, with the original failure
 * kept as the cause.
 *
 * <h2>Kinds</h2>
 * <ul>
 *   <li>{@link Kind#INVALID_URL}, {@link Kind#ENCODING_ERROR} - the request could not be built;
 *       never retried</li>
 *   <li>{@link Kind#BAD_REQUEST}, {@link Kind#UNAUTHORIZED}, {@link Kind#FORBIDDEN},
 *       {@link Kind#NOT_FOUND}, {@link Kind#SERVER_ERROR}, {@link Kind#UNEXPECTED_STATUS_CODE},
 *       {@link Kind#INVALID_RESPONSE} - the server answered with a non-success status</li>
 *   <li>{@link Kind#NO_DATA}, {@link Kind#DECODING_ERROR} - a success response whose body could
 *       not be turned into the expected type</li>
 *   <li>{@link Kind#NETWORK_FAILURE} - no response could be obtained</li>
 *   <li>{@link Kind#CANCELLED} - the call was cancelled by its caller</li>
 * </ul>
 */
public class NetworkError extends Exception {

    public enum Kind {
        INVALID_URL,
        INVALID_RESPONSE,
        NO_DATA,
        DECODING_ERROR,
        ENCODING_ERROR,
        UNAUTHORIZED,
        FORBIDDEN,
        NOT_FOUND,
        BAD_REQUEST,
        SERVER_ERROR,
        NETWORK_FAILURE,
        UNEXPECTED_STATUS_CODE,
        CANCELLED
    }

    private final Kind kind;
    private final int statusCode;
    private final @Nullable ApiError apiError;

    private NetworkError(Kind kind, String message, int statusCode, @Nullable ApiError apiError,
                         @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.apiError = apiError;
    }

    public static NetworkError invalidUrl() {
        return new NetworkError(Kind.INVALID_URL, "Invalid URL", 0, null, null);
    }

    public static NetworkError invalidUrl(Throwable cause) {
        return new NetworkError(Kind.INVALID_URL, "Invalid URL", 0, null, cause);
    }

    public static NetworkError invalidResponse() {
        return new NetworkError(Kind.INVALID_RESPONSE, "Invalid server response", 0, null, null);
    }

    public static NetworkError noData() {
        return new NetworkError(Kind.NO_DATA, "No data received", 0, null, null);
    }

    public static NetworkError decodingError(Throwable cause) {
        return new NetworkError(Kind.DECODING_ERROR, "Failed to decode response: " + describe(cause), 0, null, cause);
    }

    public static NetworkError encodingError(Throwable cause) {
        return new NetworkError(Kind.ENCODING_ERROR, "Failed to encode request: " + describe(cause), 0, null, cause);
    }

    public static NetworkError unauthorized() {
        return new NetworkError(Kind.UNAUTHORIZED, "Unauthorized access", 401, null, null);
    }

    public static NetworkError unauthorized(@Nullable Throwable cause) {
        return new NetworkError(Kind.UNAUTHORIZED, "Unauthorized access", 401, null, cause);
    }

    public static NetworkError forbidden() {
        return new NetworkError(Kind.FORBIDDEN, "Access forbidden", 403, null, null);
    }

    public static NetworkError notFound() {
        return new NetworkError(Kind.NOT_FOUND, "Resource not found", 404, null, null);
    }

    public static NetworkError badRequest(@Nullable ApiError apiError) {
        String message = apiError != null && apiError.message() != null ? apiError.message() : "Bad request";
        return new NetworkError(Kind.BAD_REQUEST, message, 400, apiError, null);
    }

    public static NetworkError serverError(int statusCode) {
        return new NetworkError(Kind.SERVER_ERROR, "Server error occurred (" + statusCode + ")", statusCode, null, null);
    }

    public static NetworkError networkFailure(Throwable cause) {
        return new NetworkError(Kind.NETWORK_FAILURE, "Network failure: " + describe(cause), 0, null, cause);
    }

    public static NetworkError unexpectedStatusCode(int statusCode) {
        return new NetworkError(Kind.UNEXPECTED_STATUS_CODE, "Unexpected status code: " + statusCode,
                statusCode, null, null);
    }

    public static NetworkError cancelled() {
        return new NetworkError(Kind.CANCELLED, "Request was cancelled", 0, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The HTTP status that caused this error.
     *
     * @return the status, or {@code 0} for errors not caused by a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public Optional<ApiError> getApiError() {
        return Optional.ofNullable(apiError);
    }

    /**
     * Whether repeating the call may succeed.
     *
     * @return {@code true} for server errors and network failures
     */
    public boolean isRetriable() {
        return kind == Kind.SERVER_ERROR || kind == Kind.NETWORK_FAILURE;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
