package net.vortexdevelopment.vwire.di.module;

import net.vortexdevelopment.vwire.di.DependencyContainer;

/**
 * Groups related registrations so they can be applied to a container in one call.
 *
 * <pre>
 * {@code
 * public class PersistenceModule extends Module {
 *     public void load(DependencyContainer container) {
 *         container.register(ConnectionPool.class, HikariConnectionPool.class, Lifetime.SINGLETON);
 *         container.register(Repository.class, JdbcRepository.class);
 *     }
 * }
 * }
 * </pre>
 */
public abstract class Module {

    /**
     * Loads registrations into the container. Called once per container.
     *
     * @param container The container to load registrations into
     */
    public abstract void load(DependencyContainer container);
}
