package io.corekit.network.session;

import java.util.Optional;

/**
 * Persistence of session credentials across process restarts.
 * <p>
 * Implementations must be safe to call from several threads. {@link NetworkSession} serializes
 * its own calls, but a store may be shared by several sessions.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link InMemoryTokenStore} - keeps tokens for the lifetime of the process</li>
 *   <li>{@link FileTokenStore} - JSON file on the local file system</li>
 * </ul>
 */
public interface TokenStore {

    /**
     * Loads the persisted tokens.
     *
     * @return the tokens, or empty if none are stored
     * @throws TokenStoreException if the stored tokens cannot be read
     */
    Optional<Tokens> load();

    /**
     * Persists tokens, replacing any stored before.
     *
     * @param tokens the tokens to store
     * @throws TokenStoreException if the tokens cannot be written
     */
    void save(Tokens tokens);

    /**
     * Removes the persisted tokens. Does nothing if none are stored.
     *
     * @throws TokenStoreException if the stored tokens cannot be removed
     */
    void clear();
}
