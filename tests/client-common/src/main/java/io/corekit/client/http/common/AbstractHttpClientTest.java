package io.corekit.client.http.common;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.okForContentType;
import static com.github.tomakehurst.wiremock.client.WireMock.patch;
import static com.github.tomakehurst.wiremock.client.WireMock.patchRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;
import io.corekit.client.http.CachePolicy;
import io.corekit.client.http.HttpClient;
import io.corekit.client.http.HttpClientBuilder;
import io.corekit.client.http.HttpResponse;
import io.corekit.client.http.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Behaviour every {@link HttpClient} implementation must share. Implementations extend this
 * class and supply their {@link HttpClientBuilder}.
 */
public abstract class AbstractHttpClientTest {

    private static final String PRODUCTS_PATH = "/v1/products";
    private static final String PRODUCT = "{\"id\":7,\"name\":\"Widget\",\"price\":9.99}";

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    protected abstract HttpClientBuilder getHttpClientBuilder();

    private String getServerUrl() {
        return "http://localhost:" + server.port();
    }

    protected HttpClient client() {
        return getHttpClientBuilder().create(getServerUrl());
    }

    @Test
    public void testGetWithBodyResponse() throws Exception {
        givenThat(get(urlEqualTo(PRODUCTS_PATH + "/7?expand=price"))
                .willReturn(okForContentType("application/json", PRODUCT)));

        HttpResponse response = client()
                .get(PRODUCTS_PATH + "/7?expand=price")
                .addHeader("Accept", "application/json")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertEquals(HttpURLConnection.HTTP_OK, response.statusCode());
        assertTrue(response.success());
        assertEquals(PRODUCT, response.body().get(5, TimeUnit.SECONDS));
        verify(getRequestedFor(urlPathEqualTo(PRODUCTS_PATH + "/7"))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testPostSendsBodyAndHeaders() throws Exception {
        givenThat(post(urlPathEqualTo(PRODUCTS_PATH))
                .willReturn(aResponse().withStatus(HttpURLConnection.HTTP_CREATED).withBody(PRODUCT)));

        HttpResponse response = client()
                .post(PRODUCTS_PATH)
                .addHeaders(Map.of("Content-Type", "application/json", "Authorization", "Bearer abc"))
                .body("{\"name\":\"Widget\",\"price\":9.99}")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertEquals(HttpURLConnection.HTTP_CREATED, response.statusCode());
        verify(postRequestedFor(urlPathEqualTo(PRODUCTS_PATH))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("Authorization", equalTo("Bearer abc"))
                .withRequestBody(equalToJson("{\"name\":\"Widget\",\"price\":9.99}")));
    }

    @Test
    public void testPutPatchDelete() throws Exception {
        givenThat(put(urlPathEqualTo(PRODUCTS_PATH + "/7")).willReturn(aResponse().withStatus(200)));
        givenThat(patch(urlPathEqualTo(PRODUCTS_PATH + "/7")).willReturn(aResponse().withStatus(200)));
        givenThat(delete(urlPathEqualTo(PRODUCTS_PATH + "/7")).willReturn(aResponse().withStatus(204)));

        HttpClient client = client();
        assertEquals(200, client.put(PRODUCTS_PATH + "/7").send("{}").get(5, TimeUnit.SECONDS).statusCode());
        assertEquals(200, client.patch(PRODUCTS_PATH + "/7").send("{}").get(5, TimeUnit.SECONDS).statusCode());
        HttpResponse deleted = client.delete(PRODUCTS_PATH + "/7").send().get(5, TimeUnit.SECONDS);
        assertEquals(204, deleted.statusCode());
        assertEquals("", deleted.body().get(5, TimeUnit.SECONDS));

        verify(putRequestedFor(urlPathEqualTo(PRODUCTS_PATH + "/7")));
        verify(patchRequestedFor(urlPathEqualTo(PRODUCTS_PATH + "/7")));
        verify(deleteRequestedFor(urlPathEqualTo(PRODUCTS_PATH + "/7")));
    }

    @Test
    public void testErrorStatusIsAResponse() throws Exception {
        givenThat(post(urlPathEqualTo(PRODUCTS_PATH))
                .willReturn(aResponse().withStatus(HttpURLConnection.HTTP_UNAUTHORIZED)
                        .withBody("{\"message\":\"token expired\"}")));

        HttpResponse response = client().post(PRODUCTS_PATH).send("{}").get(5, TimeUnit.SECONDS);

        assertEquals(HttpURLConnection.HTTP_UNAUTHORIZED, response.statusCode());
        assertEquals(false, response.success());
        assertEquals("{\"message\":\"token expired\"}", response.body().get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testResponseHeaders() throws Exception {
        givenThat(get(urlPathEqualTo(PRODUCTS_PATH))
                .willReturn(aResponse().withStatus(200).withHeader("X-Request-Id", "r-42").withBody("[]")));

        HttpResponse response = client().get(PRODUCTS_PATH).send().get(5, TimeUnit.SECONDS);

        boolean found = response.headers().entrySet().stream()
                .anyMatch(e -> e.getKey().equalsIgnoreCase("X-Request-Id") && e.getValue().contains("r-42"));
        assertTrue(found, "X-Request-Id header expected in " + response.headers());
    }

    @Test
    public void testCachePolicyIsSentAsCacheControl() throws Exception {
        givenThat(get(urlPathEqualTo(PRODUCTS_PATH)).willReturn(aResponse().withStatus(200).withBody("[]")));

        client().get(PRODUCTS_PATH)
                .cachePolicy(CachePolicy.RELOAD_IGNORING_LOCAL_AND_REMOTE_CACHE_DATA)
                .send()
                .get(5, TimeUnit.SECONDS);

        verify(getRequestedFor(urlPathEqualTo(PRODUCTS_PATH))
                .withHeader(CachePolicy.CACHE_CONTROL, equalTo("no-cache, no-store")));
    }

    @Test
    public void testTimeout() {
        givenThat(get(urlPathEqualTo(PRODUCTS_PATH))
                .willReturn(aResponse().withStatus(200).withBody("[]").withFixedDelay(3000)));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> client()
                .get(PRODUCTS_PATH)
                .timeout(Duration.ofMillis(300))
                .send()
                .get(10, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, failure.getCause());
        assertEquals(TransportException.Reason.TIMEOUT, cause.getReason());
    }

    @Test
    public void testConnectionRefused() {
        String url = getServerUrl();
        server.stop();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> getHttpClientBuilder()
                .create(url)
                .get(PRODUCTS_PATH)
                .send()
                .get(10, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, failure.getCause());
        assertEquals(TransportException.Reason.NO_CONNECTIVITY, cause.getReason());
        assertTrue(cause.isTransient());
    }

    @Test
    public void testConnectionDropped() {
        givenThat(get(urlPathEqualTo(PRODUCTS_PATH))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> client()
                .get(PRODUCTS_PATH)
                .send()
                .get(10, TimeUnit.SECONDS));

        TransportException cause = assertInstanceOf(TransportException.class, failure.getCause());
        assertTrue(cause.isTransient(), "Unexpected reason " + cause.getReason());
    }
}
