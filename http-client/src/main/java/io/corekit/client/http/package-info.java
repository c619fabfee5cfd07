/**
 * Transport layer: a small HTTP client abstraction with pluggable implementations.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.corekit.client.http.HttpClient} - origin-bound client with a fluent request builder</li>
 *   <li>{@link io.corekit.client.http.HttpClientBuilder} - factory for clients; {@code DEFAULT_FACTORY} uses the JDK client</li>
 *   <li>{@link io.corekit.client.http.HttpClientManager} - one client per origin</li>
 *   <li>{@link io.corekit.client.http.TransportException} - transport failures, classified by {@link io.corekit.client.http.TransportException.Reason}</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.corekit.client.http.jdk.JdkHttpClientBuilder} - JDK 11+ {@code java.net.http.HttpClient}</li>
 *   <li>{@code VertxHttpClientBuilder} - Vert.x based, in the {@code corekit-http-client-vertx} module</li>
 * </ul>
 */
@NullMarked
package io.corekit.client.http;

import org.jspecify.annotations.NullMarked;
