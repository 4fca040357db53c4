package net.vortexdevelopment.vwire.di.registry;

import net.vortexdevelopment.vwire.di.DependencyRepository;

/**
 * Creates a service instance by hand instead of through constructor injection.
 *
 * @param <T> The produced type
 */
@FunctionalInterface
public interface RegistrationFactory<T> {

    /**
     * @param repository The container, or the lifetime scope the service is being resolved in
     * @return The new instance, never null
     */
    T create(DependencyRepository repository);
}
