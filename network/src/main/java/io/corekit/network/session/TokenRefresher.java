package io.corekit.network.session;

import java.util.concurrent.CompletableFuture;

/**
 * Exchanges a refresh token for a new access token, typically by calling the API's token
 * endpoint.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * Requests a new access token.
     *
     * @param refreshToken the current refresh token
     * @return the new access token; completes exceptionally if the refresh is rejected
     */
    CompletableFuture<String> refresh(String refreshToken);
}
