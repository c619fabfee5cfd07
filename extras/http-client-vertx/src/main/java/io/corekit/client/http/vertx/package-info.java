/**
 * {@link io.corekit.client.http.HttpClient} implementation on top of the Vert.x HTTP client.
 */
@NullMarked
package io.corekit.client.http.vertx;

import org.jspecify.annotations.NullMarked;
