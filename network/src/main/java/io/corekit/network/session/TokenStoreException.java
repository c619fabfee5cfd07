package io.corekit.network.session;

/**
 * Failure to read, write or delete persisted {@link Tokens}.
 * <p>
 * Thrown by {@link TokenStore} implementations. The cause carries the underlying I/O or
 * serialization failure.
 *
 * @see FileTokenStore
 */
public class TokenStoreException extends RuntimeException {

    /**
     * Creates a new TokenStoreException with the specified message.
     *
     * @param msg the exception message
     */
    public TokenStoreException(final String msg) {
        super(msg);
    }

    /**
     * Creates a new TokenStoreException with the specified message and cause.
     *
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public TokenStoreException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
