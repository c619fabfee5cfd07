/**
 * A keyed dependency registry used to wire collaborators together outside the core components.
 *
 * <p>Components take their collaborators as constructor parameters. The registry is only the
 * place where an application keeps the concrete instances it wants to hand out; lookups of
 * missing entries fail with {@link io.corekit.registry.DependencyNotFoundException} so callers
 * can choose between a fallback and propagation.
 */
@NullMarked
package io.corekit.registry;

import org.jspecify.annotations.NullMarked;
