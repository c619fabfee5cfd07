package io.corekit.network;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link NetworkService#execute}. Completes with the decoded value or exceptionally
 * with a {@link NetworkError}.
 * <p>
 * {@link #cancel(boolean)} completes the call with {@link NetworkError.Kind#CANCELLED} and
 * aborts whatever the call is waiting for: the exchange in flight, a token refresh decision or
 * the delay before a retry. No request is sent after cancellation.
 *
 * @param <T> the decoded response type
 */
public class NetworkCall<T> extends CompletableFuture<T> {

    private volatile @Nullable Future<?> pending;

    NetworkCall() {
    }

    /**
     * Cancels the call.
     *
     * @param mayInterruptIfRunning ignored, the call never blocks a thread
     * @return {@code true} if this invocation completed the call
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return abort(NetworkError.cancelled());
    }

    boolean abort(NetworkError error) {
        boolean aborted = completeExceptionally(error);
        Future<?> step = pending;
        if (step != null) {
            step.cancel(true);
        }
        return aborted;
    }

    /**
     * Records the step the call is currently waiting for, so that cancellation can abort it.
     */
    void track(Future<?> step) {
        pending = step;
        if (isDone()) {
            step.cancel(true);
        }
    }
}
