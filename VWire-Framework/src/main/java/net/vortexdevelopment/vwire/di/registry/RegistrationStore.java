package net.vortexdevelopment.vwire.di.registry;

import net.vortexdevelopment.vwire.debug.DebugLogger;
import net.vortexdevelopment.vwire.di.TypeKey;
import net.vortexdevelopment.vwire.di.utils.DependencyUtils;
import net.vortexdevelopment.vwire.di.utils.Types;
import net.vortexdevelopment.vwire.exception.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Holds unkeyed and keyed registrations and synthesizes registrations for closed generics and concrete classes.
 *
 * <p>Keyed registrations are enumerated in the order their keys were first registered.
 */
public class RegistrationStore {

    private final Map<TypeKey<?>, Registration> registrations = new ConcurrentHashMap<>();
    private final Map<TypeKey<?>, Map<Object, Registration>> keyedRegistrations = new ConcurrentHashMap<>();
    private final Map<TypeKey<?>, Registration> synthesized = new ConcurrentHashMap<>();
    private final boolean cacheSynthesized;

    public RegistrationStore(boolean cacheSynthesized) {
        this.cacheSynthesized = cacheSynthesized;
    }

    /**
     * Store or overwrite the registration of a service.
     *
     * @param service The service descriptor
     * @param registration The registration to store
     * @param key Optional key, null for the default registration
     * @throws ConfigurationException if an open generic service is mapped to something that cannot be closed
     */
    public void register(@NotNull TypeKey<?> service, @NotNull Registration registration, @Nullable Object key) {
        validate(service, registration);
        if (key == null) {
            registrations.put(service, registration);
        } else {
            Map<Object, Registration> bucket = keyedRegistrations.computeIfAbsent(service,
                    k -> Collections.synchronizedMap(new LinkedHashMap<>()));
            bucket.put(key, registration);
        }
        synthesized.clear();
        DebugLogger.log(RegistrationStore.class, "Registered %s%s", registration, key != null ? " with key " + key : "");
    }

    /**
     * Store an unkeyed registration only if the service has none yet.
     *
     * @return true if the registration was stored
     */
    public boolean registerIfAbsent(@NotNull TypeKey<?> service, @NotNull Registration registration) {
        validate(service, registration);
        boolean added = registrations.putIfAbsent(service, registration) == null;
        if (added) {
            synthesized.clear();
            DebugLogger.log(RegistrationStore.class, "Registered %s", registration);
        }
        return added;
    }

    private void validate(TypeKey<?> service, Registration registration) {
        Type serviceType = service.getType();
        Type implementationType = registration.getImplementationType();
        if (!Types.isOpenGeneric(serviceType)) {
            return;
        }
        if (registration.getOrigin() == Registration.Origin.FACTORY) {
            throw new ConfigurationException(serviceType, "Factory registrations need a non-generic or closed service type, got open generic "
                    + service.getDisplayName() + ". Register it with a TypeKey instead.");
        }
        if (registration.getOrigin() != Registration.Origin.EXPLICIT) {
            return;
        }
        if (implementationType == null || !Types.isOpenGeneric(implementationType)) {
            throw new ConfigurationException(serviceType, "Implementation type must be open generic when service type is open generic. Service: "
                    + service.getDisplayName() + ", implementation: " + (implementationType != null ? implementationType.getTypeName() : "null"));
        }
        int serviceArity = ((Class<?>) serviceType).getTypeParameters().length;
        int implementationArity = ((Class<?>) implementationType).getTypeParameters().length;
        if (serviceArity != implementationArity) {
            throw new ConfigurationException(serviceType, "Open generic implementation " + implementationType.getTypeName()
                    + " declares " + implementationArity + " type parameters but service " + service.getDisplayName()
                    + " declares " + serviceArity);
        }
    }

    /**
     * Find the unkeyed registration of a service. Falls back to closing an open generic registration and then to an
     * implicit transient self-registration for concrete classes.
     *
     * @return The registration, or null if the service cannot be provided
     */
    @Nullable
    public Registration lookup(@NotNull TypeKey<?> service) {
        Registration registration = lookupRegistered(service);
        if (registration != null) {
            return registration;
        }
        if (!DependencyUtils.isImplicitlyConstructible(service.getType())) {
            return null;
        }
        return synthesize(service, Registration::implicit);
    }

    /**
     * Same as {@link #lookup(TypeKey)} without the implicit self-registration fallback.
     */
    @Nullable
    public Registration lookupRegistered(@NotNull TypeKey<?> service) {
        Registration registration = registrations.get(service);
        if (registration != null) {
            return registration;
        }
        if (!(service.getType() instanceof ParameterizedType) || !service.isClosedGeneric()) {
            return null;
        }
        Registration openRegistration = registrations.get(TypeKey.of(service.getRawType()));
        if (openRegistration == null || !openRegistration.isClosable()) {
            return null;
        }
        return synthesize(service, openRegistration::close);
    }

    private Registration synthesize(TypeKey<?> service, Function<TypeKey<?>, Registration> factory) {
        if (!cacheSynthesized) {
            Registration registration = factory.apply(service);
            DebugLogger.log(RegistrationStore.class, "Synthesized %s", registration);
            return registration;
        }
        return synthesized.computeIfAbsent(service, key -> {
            Registration registration = factory.apply(key);
            DebugLogger.log(RegistrationStore.class, "Synthesized and cached %s", registration);
            return registration;
        });
    }

    /**
     * @return The keyed registration, or null if the service has no registration under this key
     */
    @Nullable
    public Registration lookupKeyed(@NotNull TypeKey<?> service, @NotNull Object key) {
        Map<Object, Registration> bucket = keyedRegistrations.get(service);
        return bucket != null ? bucket.get(key) : null;
    }

    public boolean hasKeyedRegistrations(@NotNull TypeKey<?> service) {
        Map<Object, Registration> bucket = keyedRegistrations.get(service);
        return bucket != null && !bucket.isEmpty();
    }

    /**
     * @return Every keyed registration of the service in key registration order
     */
    @NotNull
    public List<Registration> getKeyedRegistrations(@NotNull TypeKey<?> service) {
        Map<Object, Registration> bucket = keyedRegistrations.get(service);
        if (bucket == null) {
            return List.of();
        }
        synchronized (bucket) {
            return new ArrayList<>(bucket.values());
        }
    }

    public boolean isRegistered(@NotNull TypeKey<?> service) {
        return registrations.containsKey(service);
    }

    public boolean isRegistered(@NotNull TypeKey<?> service, @NotNull Object key) {
        return lookupKeyed(service, key) != null;
    }
}
