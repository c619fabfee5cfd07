package io.corekit.network.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.corekit.network.NetworkError;
import org.junit.jupiter.api.Test;

public class NetworkSessionTest {

    @Test
    public void testLoadsStoredTokens() {
        InMemoryTokenStore store = new InMemoryTokenStore();
        store.save(new Tokens("access", "refresh"));

        NetworkSession session = new NetworkSession(store);

        assertTrue(session.isAuthenticated());
        assertEquals("access", session.accessToken());
        assertEquals("refresh", session.refreshToken());
    }

    @Test
    public void testUnreadableStoreStartsEmpty() {
        TokenStore store = mock(TokenStore.class);
        when(store.load()).thenThrow(new TokenStoreException("corrupt"));

        NetworkSession session = new NetworkSession(store);

        assertFalse(session.isAuthenticated());
    }

    @Test
    public void testSetAndClearWriteThrough() {
        InMemoryTokenStore store = new InMemoryTokenStore();
        NetworkSession session = new NetworkSession(store);

        session.setTokens("a", "r");
        assertEquals(Optional.of(new Tokens("a", "r")), store.load());

        session.clearTokens();
        assertNull(session.accessToken());
        assertNull(session.refreshToken());
        assertTrue(store.load().isEmpty());
    }

    @Test
    public void testClearFailureStillClearsSession() {
        TokenStore store = mock(TokenStore.class);
        when(store.load()).thenReturn(Optional.of(new Tokens("a", "r")));
        doThrow(new TokenStoreException("read-only")).when(store).clear();
        NetworkSession session = new NetworkSession(store);

        assertThrows(TokenStoreException.class, session::clearTokens);
        assertFalse(session.isAuthenticated());
    }

    @Test
    public void testTokensAreSetTogether() {
        NetworkSession session = new NetworkSession();

        assertThrows(IllegalArgumentException.class, () -> session.setTokens("a", null));
        assertFalse(session.isAuthenticated());
    }

    @Test
    public void testRefreshWithoutRefreshToken() {
        NetworkSession session = new NetworkSession(new InMemoryTokenStore(), refreshToken -> CompletableFuture.completedFuture("x"));

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> session.refreshAccessToken().get(5, TimeUnit.SECONDS));
        assertEquals(NetworkError.Kind.UNAUTHORIZED, ((NetworkError) failure.getCause()).getKind());
    }

    @Test
    public void testRefreshWithoutRefresherFailsAndClears() {
        NetworkSession session = new NetworkSession();
        session.setTokens("a", "r");

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> session.refreshAccessToken().get(5, TimeUnit.SECONDS));
        assertEquals(NetworkError.Kind.UNAUTHORIZED, ((NetworkError) failure.getCause()).getKind());
        assertFalse(session.isAuthenticated());
    }

    @Test
    public void testSuccessfulRefreshKeepsRefreshToken() throws Exception {
        InMemoryTokenStore store = new InMemoryTokenStore();
        NetworkSession session = new NetworkSession(store, refreshToken -> CompletableFuture.completedFuture("new-" + refreshToken));
        session.setTokens("old", "r1");

        assertEquals("new-r1", session.refreshAccessToken().get(5, TimeUnit.SECONDS));
        assertEquals("new-r1", session.accessToken());
        assertEquals("r1", session.refreshToken());
        assertEquals(Optional.of(new Tokens("new-r1", "r1")), store.load());
    }

    @Test
    public void testRejectedRefreshClearsSession() {
        NetworkSession session = new NetworkSession(new InMemoryTokenStore(),
                refreshToken -> CompletableFuture.failedFuture(new IOException("invalid_grant")));
        session.setTokens("old", "r1");

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> session.refreshAccessToken().get(5, TimeUnit.SECONDS));
        NetworkError error = assertInstanceOf(NetworkError.class, failure.getCause());
        assertEquals(NetworkError.Kind.UNAUTHORIZED, error.getKind());
        assertInstanceOf(IOException.class, error.getCause());
        assertFalse(session.isAuthenticated());
    }

    @Test
    public void testConcurrentRefreshesShareOneExchange() throws Exception {
        AtomicInteger exchanges = new AtomicInteger();
        CompletableFuture<String> pending = new CompletableFuture<>();
        NetworkSession session = new NetworkSession(new InMemoryTokenStore(), refreshToken -> {
            exchanges.incrementAndGet();
            return pending;
        });
        session.setTokens("old", "r1");

        CompletableFuture<String> first = session.refreshAccessToken();
        CompletableFuture<String> second = session.refreshAccessToken();
        assertSame(first, second);

        pending.complete("fresh");
        assertEquals("fresh", first.get(5, TimeUnit.SECONDS));
        assertEquals(1, exchanges.get());
        assertEquals("fresh", session.accessToken());

        // a later refresh starts a new exchange
        session.refreshAccessToken().get(5, TimeUnit.SECONDS);
        assertEquals(2, exchanges.get());
    }
}
