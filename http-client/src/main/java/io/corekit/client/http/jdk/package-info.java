@NullMarked
package io.corekit.client.http.jdk;

import org.jspecify.annotations.NullMarked;
