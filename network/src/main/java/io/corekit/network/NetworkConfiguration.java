package io.corekit.network;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Properties;

import io.corekit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings shared by all calls of a {@link NetworkService}.
 *
 * @param timeoutInterval connect timeout of the default transport
 * @param retryLimit upper bound for the retries of every call; an endpoint may lower it further
 * @param retryDelay wait between a transient failure and its retry
 * @param callTimeout overall deadline of a call including all retries, or {@code null} for none
 */
public record NetworkConfiguration(Duration timeoutInterval, int retryLimit, Duration retryDelay,
                                   @Nullable Duration callTimeout) {

    public static final Duration DEFAULT_TIMEOUT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_LIMIT = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    public static final String PROPERTIES_RESOURCE = "corekit-network.properties";
    public static final String TIMEOUT_INTERVAL = "corekit.network.timeout-interval";
    public static final String RETRY_LIMIT = "corekit.network.retry-limit";
    public static final String RETRY_DELAY = "corekit.network.retry-delay";
    public static final String CALL_TIMEOUT = "corekit.network.call-timeout";

    public static final NetworkConfiguration DEFAULT = builder().build();

    public NetworkConfiguration {
        Assert.checkNotNullParam("timeoutInterval", timeoutInterval);
        Assert.checkNotNullParam("retryDelay", retryDelay);
        Assert.checkMinimumParameter("retryLimit", retryLimit);
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("Parameter 'retryDelay' must not be negative: " + retryDelay);
        }
    }

    public Optional<Duration> callTimeoutValue() {
        return Optional.ofNullable(callTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from properties. Missing keys keep their default; durations use the
     * ISO-8601 format, for example {@code PT1.5S}.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static NetworkConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String value = properties.getProperty(TIMEOUT_INTERVAL);
        if (value != null) {
            builder.timeoutInterval(parseDuration(TIMEOUT_INTERVAL, value));
        }
        value = properties.getProperty(RETRY_LIMIT);
        if (value != null) {
            try {
                builder.retryLimit(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + RETRY_LIMIT + ": " + value, e);
            }
        }
        value = properties.getProperty(RETRY_DELAY);
        if (value != null) {
            builder.retryDelay(parseDuration(RETRY_DELAY, value));
        }
        value = properties.getProperty(CALL_TIMEOUT);
        if (value != null && !value.isBlank()) {
            builder.callTimeout(parseDuration(CALL_TIMEOUT, value));
        }
        return builder.build();
    }

    /**
     * Reads {@value #PROPERTIES_RESOURCE} from the class path, or returns {@link #DEFAULT} if there
     * is no such resource.
     *
     * @return the configuration
     * @throws IllegalStateException if the resource cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static NetworkConfiguration load() {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = NetworkConfiguration.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in == null) {
                return DEFAULT;
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + PROPERTIES_RESOURCE, e);
        }
    }

    private static Duration parseDuration(String key, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    public static class Builder {
        private Duration timeoutInterval = DEFAULT_TIMEOUT_INTERVAL;
        private int retryLimit = DEFAULT_RETRY_LIMIT;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private @Nullable Duration callTimeout;

        private Builder() {
        }

        public Builder timeoutInterval(Duration timeoutInterval) {
            this.timeoutInterval = timeoutInterval;
            return this;
        }

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder callTimeout(@Nullable Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public NetworkConfiguration build() {
            return new NetworkConfiguration(timeoutInterval, retryLimit, retryDelay, callTimeout);
        }
    }
}
