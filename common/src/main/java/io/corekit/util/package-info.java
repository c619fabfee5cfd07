@NullMarked
package io.corekit.util;

import org.jspecify.annotations.NullMarked;
