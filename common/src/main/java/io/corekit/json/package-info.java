/**
 * Tagged JSON values for request payloads.
 *
 * <p>{@link io.corekit.json.JsonValue} replaces untyped {@code Map<String, Object>} bodies with a
 * closed set of variants. {@link io.corekit.json.JsonValueModule} teaches Jackson how to write and
 * read them.
 */
@NullMarked
package io.corekit.json;

import org.jspecify.annotations.NullMarked;
