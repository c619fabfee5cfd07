package io.corekit.client.http;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import javax.net.ssl.SSLException;

import io.corekit.util.Utils;

/**
 * Failure to obtain an HTTP response at all.
 * <p>
 * The {@link Reason} tells transient conditions, which a retry may cure, apart from failures
 * that will repeat on every attempt.
 *
 * <h2>Transient Reasons</h2>
 * <ul>
 *   <li>{@link Reason#TIMEOUT} - no response within the request timeout</li>
 *   <li>{@link Reason#NO_CONNECTIVITY} - connection refused, host unknown or unreachable</li>
 *   <li>{@link Reason#CONNECTION_LOST} - the connection broke during the exchange</li>
 * </ul>
 * Everything else (TLS handshake failures, protocol errors) is {@link Reason#OTHER}.
 */
public class TransportException extends IOException {

    public enum Reason {
        TIMEOUT,
        NO_CONNECTIVITY,
        CONNECTION_LOST,
        OTHER
    }

    private final Reason reason;

    public TransportException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransportException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Whether the failure is transient (timeout, no connectivity, connection lost).
     *
     * @return {@code true} unless the reason is {@link Reason#OTHER}
     */
    public boolean isTransient() {
        return reason != Reason.OTHER;
    }

    /**
     * Translates a failure raised by an underlying client into a {@link TransportException}.
     * Cancellation and failures that already are transport exceptions pass through unchanged.
     *
     * @param failure the failure, possibly wrapped in a {@link CompletionException}
     * @return the translated failure
     */
    public static Throwable translate(Throwable failure) {
        Throwable cause = Utils.unwrapCompletionException(failure);
        if (cause instanceof CancellationException || cause instanceof TransportException) {
            return cause;
        }
        Reason reason = classify(cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransportException(reason, message, cause);
    }

    static Reason classify(Throwable cause) {
        if (cause instanceof HttpTimeoutException
                || cause instanceof TimeoutException
                || (cause instanceof InterruptedIOException && !(cause instanceof SocketException))) {
            return Reason.TIMEOUT;
        }
        if (cause instanceof ConnectException
                || cause instanceof UnknownHostException
                || cause instanceof NoRouteToHostException
                || cause instanceof PortUnreachableException) {
            return Reason.NO_CONNECTIVITY;
        }
        if (cause instanceof SSLException) {
            return Reason.OTHER;
        }
        if (cause instanceof EOFException
                || cause instanceof ClosedChannelException
                || cause instanceof SocketException
                || cause instanceof IOException) {
            return Reason.CONNECTION_LOST;
        }
        return Reason.OTHER;
    }
}
