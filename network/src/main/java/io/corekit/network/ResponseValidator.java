package io.corekit.network;

import org.jspecify.annotations.Nullable;

/**
 * Classifies a response as success or as a {@link NetworkError}.
 */
public interface ResponseValidator {

    /**
     * Validates a response.
     *
     * @param body the response body
     * @param response the response, {@code null} if the transport delivered none
     * @throws NetworkError if the response is not a success
     */
    void validate(@Nullable String body, @Nullable Response response) throws NetworkError;
}
