package io.corekit.network;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.corekit.util.Assert;

/**
 * Retry bookkeeping of a single call. A fresh instance is created for every
 * {@link NetworkService#execute} and never shared between calls.
 * <p>
 * Two budgets are tracked separately: retries of transient failures, bounded by
 * {@link #limit()}, and a single retry after a token refresh.
 */
public final class RetryState {

    private final int limit;
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicBoolean refreshUsed = new AtomicBoolean();

    public RetryState(int limit) {
        this.limit = Assert.checkMinimumParameter("limit", limit);
    }

    public int limit() {
        return limit;
    }

    /**
     * Number of retries of transient failures performed so far.
     *
     * @return the retry count
     */
    public int attempts() {
        return attempts.get();
    }

    public boolean isExhausted() {
        return attempts.get() >= limit;
    }

    /**
     * Records a retry of a transient failure.
     *
     * @return the retry count including this one
     */
    public int increment() {
        return attempts.incrementAndGet();
    }

    /**
     * Claims the refresh retry.
     *
     * @return {@code true} the first time, {@code false} once the refresh retry has been used
     */
    public boolean tryConsumeRefresh() {
        return refreshUsed.compareAndSet(false, true);
    }

    public boolean isRefreshUsed() {
        return refreshUsed.get();
    }

    @Override
    public String toString() {
        return "RetryState{attempts=" + attempts.get() + ", limit=" + limit + ", refreshUsed=" + refreshUsed.get() + '}';
    }
}
