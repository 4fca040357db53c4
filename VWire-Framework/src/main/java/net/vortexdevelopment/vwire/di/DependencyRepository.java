package net.vortexdevelopment.vwire.di;

import net.vortexdevelopment.vwire.di.registry.Lifetime;
import net.vortexdevelopment.vwire.di.registry.RegistrationFactory;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Register and resolve services. Implemented by {@link DependencyContainer} and by its {@link LifetimeScope}s,
 * which forward every registration to their container.
 */
public interface DependencyRepository {

    /**
     * Map a service to an implementation with {@link Lifetime#TRANSIENT} lifetime.
     *
     * @param service The service type, may be an open generic such as {@code Repository.class}
     * @param implementation The implementation type, must be open generic if the service is
     */
    <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation);

    <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime);

    /**
     * Map a service to an implementation under a key. Keyed registrations are only found by
     * {@link #resolve(Class, Object)} and by collection resolution.
     *
     * @param key Non-null key distinguishing this registration from others of the same service
     */
    <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime, @NotNull Object key);

    /**
     * Map a parameterized service, e.g. {@code new TypeKey<Repository<Customer>>() {}}, to an implementation.
     */
    <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime);

    <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime, @NotNull Object key);

    /**
     * Register a pre-built singleton. It is returned unchanged by every resolve call.
     */
    <S> void registerInstance(@NotNull Class<S> service, @NotNull S instance);

    <S> void registerInstance(@NotNull TypeKey<S> service, @NotNull S instance);

    /**
     * Register a factory callback. The factory replaces constructor and property injection.
     */
    <S> void register(@NotNull Class<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime);

    <S> void register(@NotNull TypeKey<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime);

    @NotNull <T> T resolve(@NotNull Class<T> service);

    /**
     * Resolve a parameterized service. {@code List<T>}, {@code Collection<T>} and {@code Iterable<T>} without an
     * explicit registration resolve to every registration of {@code T}.
     */
    @NotNull <T> T resolve(@NotNull TypeKey<T> service);

    @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Object key);

    @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Object key);

    /**
     * Resolve with constructor arguments supplied by parameter name. Overrides apply to the requested service's own
     * constructor only, not to its dependencies.
     */
    @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Map<String, ?> overrides);

    @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Map<String, ?> overrides);

    /**
     * Resolve the unkeyed registration of {@code service}, if any, followed by every keyed registration.
     *
     * @return The instances, empty if nothing is registered
     */
    @NotNull <T> List<T> resolveAll(@NotNull Class<T> service);

    /**
     * @return true if an unkeyed registration exists; synthesized registrations are not counted
     */
    boolean isRegistered(@NotNull Class<?> service);

    boolean isRegistered(@NotNull Class<?> service, @NotNull Object key);
}
