/**
 * Typed HTTP request pipeline.
 *
 * <p>An {@link io.corekit.network.Endpoint} describes an API operation. The
 * {@link io.corekit.network.NetworkService} turns it into a {@link io.corekit.network.Request},
 * lets the {@link io.corekit.network.RequestInterceptor} add authentication, sends it through a
 * {@link io.corekit.network.Transport} with bounded retries, validates the response with the
 * {@link io.corekit.network.ResponseValidator} and decodes the body.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * NetworkSession session = new NetworkSession(new FileTokenStore(tokensFile), refresher);
 * NetworkService service = NetworkService.builder()
 *     .session(session)
 *     .configuration(NetworkConfiguration.load())
 *     .build();
 *
 * Product created = service.execute(
 *         Endpoint.builder(HttpMethod.POST, "products")
 *             .baseUrl("https://api.example.com/v1")
 *             .body(Map.of("name", "Widget", "price", 9.99))
 *             .build(),
 *         Product.class)
 *     .get();
 * }</pre>
 *
 * @see io.corekit.network.NetworkError
 * @see io.corekit.network.session.NetworkSession
 */
@NullMarked
package io.corekit.network;

import org.jspecify.annotations.NullMarked;
