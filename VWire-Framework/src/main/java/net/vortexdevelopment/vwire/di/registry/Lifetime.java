package net.vortexdevelopment.vwire.di.registry;

/**
 * Reuse policy of a registration.
 */
public enum Lifetime {

    /**
     * Every resolve call creates a new instance.
     */
    TRANSIENT,

    /**
     * One instance per container, created on first resolve.
     */
    SINGLETON,

    /**
     * One instance per {@link net.vortexdevelopment.vwire.di.LifetimeScope}.
     */
    SCOPED
}
