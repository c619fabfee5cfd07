/**
 * Session credentials and their persistence.
 */
@NullMarked
package io.corekit.network.session;

import org.jspecify.annotations.NullMarked;
