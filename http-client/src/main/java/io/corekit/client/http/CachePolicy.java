package io.corekit.client.http;

import org.jspecify.annotations.Nullable;

/**
 * Caching behaviour requested for a single request.
 * <p>
 * The transports in this module do not cache responses themselves; they pass the policy on to
 * caches along the way (proxies, CDNs, the origin) as a {@code Cache-Control} request directive.
 */
public enum CachePolicy {
    /** Follow whatever caching the protocol and the server headers allow. */
    USE_PROTOCOL_CACHE_POLICY(null),
    /** Revalidate with the origin before using a cached response. */
    RELOAD_IGNORING_LOCAL_CACHE_DATA("no-cache"),
    /** Bypass every cache and do not store the response. */
    RELOAD_IGNORING_LOCAL_AND_REMOTE_CACHE_DATA("no-cache, no-store"),
    /** Accept a cached response regardless of its age. */
    RETURN_CACHE_DATA_ELSE_LOAD("max-stale"),
    /** Only accept a cached response; never go to the origin. */
    RETURN_CACHE_DATA_DONT_LOAD("only-if-cached");

    public static final String CACHE_CONTROL = "Cache-Control";

    private final @Nullable String cacheControl;

    CachePolicy(@Nullable String cacheControl) {
        this.cacheControl = cacheControl;
    }

    /**
     * Returns the {@code Cache-Control} directive expressing this policy.
     *
     * @return the directive, or {@code null} when no header should be sent
     */
    public @Nullable String cacheControl() {
        return cacheControl;
    }
}
