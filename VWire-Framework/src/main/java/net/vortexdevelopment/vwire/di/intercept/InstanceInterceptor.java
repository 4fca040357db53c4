package net.vortexdevelopment.vwire.di.intercept;

import net.vortexdevelopment.vwire.di.registry.Registration;
import org.jetbrains.annotations.NotNull;

/**
 * Post-construction transform applied to every instance the container builds, factory-made ones included.
 * Cached singleton and scoped instances are not intercepted again.
 *
 * <p>Interceptors run in the order they were added. Returning the given instance leaves it unchanged; returning
 * another object (e.g. a decorator implementing the same service interface) replaces it.
 */
@FunctionalInterface
public interface InstanceInterceptor {

    /**
     * @param registration The registration the instance was built for
     * @param instance The constructed and injected instance
     * @return The instance to hand out, never null
     */
    @NotNull
    Object intercept(@NotNull Registration registration, @NotNull Object instance);
}
