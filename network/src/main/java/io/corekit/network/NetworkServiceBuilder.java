package io.corekit.network;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.corekit.network.session.NetworkSession;
import io.corekit.registry.DependencyRegistry;
import io.corekit.util.Assert;
import io.corekit.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Assembles a {@link NetworkService}. Collaborators that are not set get a default:
 * <ul>
 *   <li>configuration - {@link NetworkConfiguration#DEFAULT}</li>
 *   <li>session - an empty in-memory {@link NetworkSession}</li>
 *   <li>interceptor - {@link DefaultRequestInterceptor} on the session, with the configured retry delay</li>
 *   <li>validator - {@link DefaultResponseValidator}</li>
 *   <li>transport - {@link HttpClientTransport} on the JDK HTTP client</li>
 * </ul>
 */
public class NetworkServiceBuilder {

    private @Nullable Transport transport;
    private @Nullable NetworkSession session;
    private @Nullable RequestInterceptor interceptor;
    private @Nullable ResponseValidator validator;
    private @Nullable NetworkConfiguration configuration;
    private ObjectMapper objectMapper = Utils.SNAKE_CASE_MAPPER;

    NetworkServiceBuilder() {
    }

    public NetworkServiceBuilder transport(Transport transport) {
        this.transport = Assert.checkNotNullParam("transport", transport);
        return this;
    }

    public NetworkServiceBuilder session(NetworkSession session) {
        this.session = Assert.checkNotNullParam("session", session);
        return this;
    }

    public NetworkServiceBuilder interceptor(RequestInterceptor interceptor) {
        this.interceptor = Assert.checkNotNullParam("interceptor", interceptor);
        return this;
    }

    public NetworkServiceBuilder validator(ResponseValidator validator) {
        this.validator = Assert.checkNotNullParam("validator", validator);
        return this;
    }

    public NetworkServiceBuilder configuration(NetworkConfiguration configuration) {
        this.configuration = Assert.checkNotNullParam("configuration", configuration);
        return this;
    }

    /**
     * Sets the mapper used to decode response bodies. Defaults to {@link Utils#SNAKE_CASE_MAPPER}.
     *
     * @param objectMapper the mapper
     * @return this builder
     */
    public NetworkServiceBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = Assert.checkNotNullParam("objectMapper", objectMapper);
        return this;
    }

    /**
     * Takes every collaborator registered in the registry under its type. Collaborators missing
     * from the registry keep their current value.
     *
     * @param registry the registry
     * @return this builder
     */
    public NetworkServiceBuilder from(DependencyRegistry registry) {
        Assert.checkNotNullParam("registry", registry);
        registry.find(Transport.class).ifPresent(this::transport);
        registry.find(NetworkSession.class).ifPresent(this::session);
        registry.find(RequestInterceptor.class).ifPresent(this::interceptor);
        registry.find(ResponseValidator.class).ifPresent(this::validator);
        registry.find(NetworkConfiguration.class).ifPresent(this::configuration);
        return this;
    }

    public NetworkService build() {
        NetworkConfiguration config = configuration != null ? configuration : NetworkConfiguration.DEFAULT;
        RequestInterceptor requestInterceptor = interceptor;
        if (requestInterceptor == null) {
            NetworkSession networkSession = session != null ? session : new NetworkSession();
            requestInterceptor = new DefaultRequestInterceptor(networkSession, config.retryDelay());
        }
        return new NetworkService(
                transport != null ? transport : HttpClientTransport.create(config),
                requestInterceptor,
                validator != null ? validator : new DefaultResponseValidator(),
                config,
                new RequestBuilder(),
                objectMapper);
    }
}
