package net.vortexdevelopment.vwire.di;

import net.vortexdevelopment.vwire.di.registry.Lifetime;
import net.vortexdevelopment.vwire.di.registry.Registration;
import net.vortexdevelopment.vwire.di.registry.RegistrationFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Resolution context that keeps one instance per {@link Lifetime#SCOPED} registration.
 * Registrations made through the scope go to the parent container.
 *
 * <p>Closing the scope drops its cached instances. The instances themselves are not disposed.
 */
public class LifetimeScope implements DependencyRepository, AutoCloseable {

    private final DependencyContainer parent;
    private final Map<Registration, Object> scopedInstances = new IdentityHashMap<>();
    private final Map<Registration, PendingInstance> pendingInstances = new IdentityHashMap<>();
    private volatile boolean closed;

    LifetimeScope(@NotNull DependencyContainer parent) {
        this.parent = parent;
    }

    @NotNull
    public DependencyContainer getParent() {
        return parent;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Tries to get a cached scoped instance for the given registration.
     */
    @Nullable
    synchronized Object getScopedInstance(@NotNull Registration registration) {
        return scopedInstances.get(registration);
    }

    /**
     * Returns the cached instance or creates, caches and returns a new one. The scope's lock only guards the cache,
     * construction runs outside of it. A thread asking for a registration another thread is already building waits
     * for that instance, so one scope never builds the same registration twice.
     */
    Object computeScopedInstance(@NotNull Registration registration, @NotNull Supplier<Object> creator) {
        PendingInstance pendingInstance;
        boolean owner = false;
        synchronized (this) {
            Object instance = scopedInstances.get(registration);
            if (instance != null) {
                return instance;
            }
            pendingInstance = pendingInstances.get(registration);
            if (pendingInstance == null) {
                pendingInstance = new PendingInstance();
                pendingInstances.put(registration, pendingInstance);
                owner = true;
            }
        }
        if (owner) {
            return create(registration, pendingInstance, creator);
        }
        if (pendingInstance.owner == Thread.currentThread()) {
            // Re-entered while building it, construction reports the cycle
            return creator.get();
        }
        return pendingInstance.await();
    }

    private Object create(Registration registration, PendingInstance pendingInstance, Supplier<Object> creator) {
        Object instance;
        try {
            instance = creator.get();
        } catch (RuntimeException | Error e) {
            synchronized (this) {
                pendingInstances.remove(registration);
            }
            pendingInstance.result.completeExceptionally(e);
            throw e;
        }
        synchronized (this) {
            pendingInstances.remove(registration);
            scopedInstances.put(registration, instance);
        }
        pendingInstance.result.complete(instance);
        return instance;
    }

    synchronized int size() {
        return scopedInstances.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        scopedInstances.clear();
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation) {
        parent.register(service, implementation);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime) {
        parent.register(service, implementation, lifetime);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime, @NotNull Object key) {
        parent.register(service, implementation, lifetime, key);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime) {
        parent.register(service, implementation, lifetime);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime, @NotNull Object key) {
        parent.register(service, implementation, lifetime, key);
    }

    @Override
    public <S> void registerInstance(@NotNull Class<S> service, @NotNull S instance) {
        parent.registerInstance(service, instance);
    }

    @Override
    public <S> void registerInstance(@NotNull TypeKey<S> service, @NotNull S instance) {
        parent.registerInstance(service, instance);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime) {
        parent.register(service, factory, lifetime);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime) {
        parent.register(service, factory, lifetime);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service) {
        return resolve(TypeKey.of(service));
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service) {
        return (T) parent.resolve(service, this, null, null);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Object key) {
        return resolve(TypeKey.of(service), key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Object key) {
        return (T) parent.resolve(service, this, key, null);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Map<String, ?> overrides) {
        return resolve(TypeKey.of(service), overrides);
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Map<String, ?> overrides) {
        return (T) parent.resolve(service, this, null, overrides);
    }

    @Override
    public @NotNull <T> List<T> resolveAll(@NotNull Class<T> service) {
        return parent.resolveAll(service, this);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> service) {
        return parent.isRegistered(service);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> service, @NotNull Object key) {
        return parent.isRegistered(service, key);
    }

    private static final class PendingInstance {
        private final Thread owner = Thread.currentThread();
        private final CompletableFuture<Object> result = new CompletableFuture<>();

        private Object await() {
            try {
                return result.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (e.getCause() instanceof Error error) {
                    throw error;
                }
                throw e;
            }
        }
    }
}
