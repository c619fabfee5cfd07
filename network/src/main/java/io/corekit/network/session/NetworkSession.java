package io.corekit.network.session;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import io.corekit.network.NetworkError;
import io.corekit.util.Assert;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holder of the caller's credentials.
 * <p>
 * A session is shared by every {@link io.corekit.network.NetworkService} it is handed to; there
 * is no global instance. Tokens are set and cleared together, and every change is written
 * through to the {@link TokenStore}. Tokens found in the store are loaded on construction.
 *
 * <h2>Token Refresh</h2>
 * {@link #refreshAccessToken()} exchanges the refresh token for a new access token through the
 * configured {@link TokenRefresher}. Concurrent callers share a single refresh. On success the
 * new access token is stored together with the unchanged refresh token; on failure the session
 * is cleared.
 */
public class NetworkSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkSession.class);

    private final TokenStore tokenStore;
    private final @Nullable TokenRefresher tokenRefresher;
    private final AtomicReference<@Nullable CompletableFuture<String>> refreshInFlight = new AtomicReference<>();

    private @Nullable Tokens tokens;

    public NetworkSession() {
        this(new InMemoryTokenStore(), null);
    }

    public NetworkSession(TokenStore tokenStore) {
        this(tokenStore, null);
    }

    public NetworkSession(TokenStore tokenStore, @Nullable TokenRefresher tokenRefresher) {
        this.tokenStore = Assert.checkNotNullParam("tokenStore", tokenStore);
        this.tokenRefresher = tokenRefresher;
        this.tokens = loadTokens(tokenStore);
    }

    private static @Nullable Tokens loadTokens(TokenStore tokenStore) {
        try {
            return tokenStore.load().orElse(null);
        } catch (TokenStoreException e) {
            LOGGER.warn("Ignoring unreadable stored tokens: {}", e.getMessage(), e);
            return null;
        }
    }

    public synchronized @Nullable String accessToken() {
        return tokens == null ? null : tokens.accessToken();
    }

    public synchronized @Nullable String refreshToken() {
        return tokens == null ? null : tokens.refreshToken();
    }

    public synchronized Optional<Tokens> tokens() {
        return Optional.ofNullable(tokens);
    }

    public synchronized boolean isAuthenticated() {
        return tokens != null;
    }

    /**
     * Replaces both tokens and persists them.
     *
     * @param accessToken the new access token
     * @param refreshToken the new refresh token
     * @throws TokenStoreException if the tokens cannot be persisted; the session keeps the new tokens
     */
    public void setTokens(String accessToken, String refreshToken) {
        Tokens newTokens = new Tokens(accessToken, refreshToken);
        synchronized (this) {
            tokens = newTokens;
            tokenStore.save(newTokens);
        }
    }

    /**
     * Removes both tokens from the session and the store.
     *
     * @throws TokenStoreException if the stored tokens cannot be removed; the session is cleared anyway
     */
    public void clearTokens() {
        synchronized (this) {
            tokens = null;
            tokenStore.clear();
        }
    }

    /**
     * Obtains a new access token.
     * <p>
     * If a refresh is already running, the returned future is the one of that refresh.
     *
     * @return the new access token; fails with {@link NetworkError.Kind#UNAUTHORIZED} if there is
     *         no refresh token, no {@link TokenRefresher} is configured or the refresh is rejected
     */
    public CompletableFuture<String> refreshAccessToken() {
        while (true) {
            CompletableFuture<String> running = refreshInFlight.get();
            if (running != null) {
                return running;
            }
            CompletableFuture<String> refresh = new CompletableFuture<>();
            if (refreshInFlight.compareAndSet(null, refresh)) {
                startRefresh(refresh);
                return refresh;
            }
        }
    }

    private void startRefresh(CompletableFuture<String> refresh) {
        String refreshToken = refreshToken();
        if (refreshToken == null || tokenRefresher == null) {
            LOGGER.debug(refreshToken == null ? "No refresh token available" : "No token refresher configured");
            finishRefresh(refresh, null, refreshToken, NetworkError.unauthorized());
            return;
        }

        LOGGER.debug("Refreshing access token");
        CompletableFuture<String> exchange;
        try {
            exchange = tokenRefresher.refresh(refreshToken);
        } catch (RuntimeException e) {
            exchange = CompletableFuture.failedFuture(e);
        }
        exchange.whenComplete((accessToken, failure) -> {
            if (failure == null && accessToken != null) {
                finishRefresh(refresh, accessToken, refreshToken, null);
            } else {
                finishRefresh(refresh, null, refreshToken, failure);
            }
        });
    }

    private void finishRefresh(CompletableFuture<String> refresh, @Nullable String accessToken,
                               @Nullable String refreshToken, @Nullable Throwable failure) {
        try {
            if (accessToken != null && refreshToken != null) {
                setTokens(accessToken, refreshToken);
                LOGGER.debug("Access token refreshed");
            } else {
                LOGGER.warn("Token refresh failed, clearing session: {}",
                        failure == null ? "no access token returned" : Utils.unwrapCompletionException(failure).getMessage());
                clearTokens();
            }
        } catch (TokenStoreException e) {
            LOGGER.error("Failed to persist session change after token refresh", e);
        } finally {
            refreshInFlight.set(null);
        }

        if (accessToken != null) {
            refresh.complete(accessToken);
        } else {
            @Nullable Throwable cause = failure == null ? null : Utils.unwrapCompletionException(failure);
            refresh.completeExceptionally(cause instanceof NetworkError ? cause : NetworkError.unauthorized(cause));
        }
    }
}
