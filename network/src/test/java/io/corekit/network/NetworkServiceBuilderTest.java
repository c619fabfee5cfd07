package io.corekit.network;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.corekit.client.http.HttpMethod;
import io.corekit.network.session.NetworkSession;
import io.corekit.registry.DependencyRegistry;
import org.junit.jupiter.api.Test;

public class NetworkServiceBuilderTest {

    @Test
    public void testDefaults() {
        NetworkService service = NetworkService.builder().build();

        assertSame(NetworkConfiguration.DEFAULT, service.getConfiguration());
        assertInstanceOf(DefaultRequestInterceptor.class, service.getInterceptor());
    }

    @Test
    public void testWiresFromRegistry() throws Exception {
        NetworkSession session = new NetworkSession();
        session.setTokens("registry-token", "refresh");
        ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");
        NetworkConfiguration configuration = NetworkConfiguration.builder().retryDelay(Duration.ofMillis(5)).build();

        DependencyRegistry registry = new DependencyRegistry();
        registry.register(Transport.class, transport);
        registry.register(NetworkSession.class, session);
        registry.register(NetworkConfiguration.class, configuration);

        NetworkService service = NetworkService.builder().from(registry).build();
        service.execute(Endpoint.builder(HttpMethod.GET, "me").baseUrl("https://api.example.com").build())
                .get(5, TimeUnit.SECONDS);

        assertSame(configuration, service.getConfiguration());
        DefaultRequestInterceptor interceptor = assertInstanceOf(DefaultRequestInterceptor.class, service.getInterceptor());
        assertSame(session, interceptor.getSession());
        assertEquals("Bearer registry-token", transport.sent().get(0).header("Authorization"));
    }

    @Test
    public void testRegisteredCollaboratorsWinOverDefaults() throws Exception {
        RequestInterceptor interceptor = mock(RequestInterceptor.class);
        when(interceptor.adapt(any())).thenAnswer(invocation -> invocation.getArgument(0));
        ResponseValidator validator = mock(ResponseValidator.class);
        ScriptedTransport transport = new ScriptedTransport().respond(299, "");

        DependencyRegistry registry = new DependencyRegistry();
        registry.register(RequestInterceptor.class, interceptor);
        registry.register(ResponseValidator.class, validator);
        registry.register(Transport.class, transport);

        NetworkService service = NetworkService.builder().from(registry).build();
        service.execute(Endpoint.builder(HttpMethod.GET, "ping").baseUrl("https://api.example.com").build())
                .get(5, TimeUnit.SECONDS);

        assertSame(interceptor, service.getInterceptor());
        verify(interceptor).adapt(any());
        verify(validator).validate(any(), any());
    }

    @Test
    public void testCustomInterceptorRetryDecision() throws Exception {
        RequestInterceptor interceptor = mock(RequestInterceptor.class);
        when(interceptor.adapt(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(interceptor.shouldRetry(any(), any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(RetryDecision.RETRY_NOW));
        ScriptedTransport transport = new ScriptedTransport().respond(418, "").respond(200, "");

        NetworkService service = NetworkService.builder().transport(transport).interceptor(interceptor).build();
        service.execute(Endpoint.builder(HttpMethod.GET, "teapot").baseUrl("https://api.example.com").build())
                .get(5, TimeUnit.SECONDS);

        assertEquals(2, transport.sendCount());
    }
}
