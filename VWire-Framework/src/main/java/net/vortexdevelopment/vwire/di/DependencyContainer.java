package net.vortexdevelopment.vwire.di;

import lombok.Getter;
import net.vortexdevelopment.vwire.config.ContainerSettings;
import net.vortexdevelopment.vwire.debug.DebugLogger;
import net.vortexdevelopment.vwire.di.engine.ConstructionPlan;
import net.vortexdevelopment.vwire.di.engine.InjectionEngine;
import net.vortexdevelopment.vwire.di.engine.ResolutionStack;
import net.vortexdevelopment.vwire.di.intercept.InstanceInterceptor;
import net.vortexdevelopment.vwire.di.module.Module;
import net.vortexdevelopment.vwire.di.registry.Lifetime;
import net.vortexdevelopment.vwire.di.registry.Registration;
import net.vortexdevelopment.vwire.di.registry.RegistrationFactory;
import net.vortexdevelopment.vwire.di.registry.RegistrationStore;
import net.vortexdevelopment.vwire.di.scan.TypeSource;
import net.vortexdevelopment.vwire.di.utils.DependencyUtils;
import net.vortexdevelopment.vwire.di.utils.Types;
import net.vortexdevelopment.vwire.exception.ConfigurationException;
import net.vortexdevelopment.vwire.exception.ConstructionException;
import net.vortexdevelopment.vwire.exception.DependencyContainerException;
import net.vortexdevelopment.vwire.exception.LifetimeViolationException;
import net.vortexdevelopment.vwire.exception.NotRegisteredException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Registers services and builds object graphs from them.
 *
 * <p>The container registers itself as {@link DependencyRepository} and {@link DependencyContainer}, so components
 * and factories can ask for it. Scoped services are resolved through a {@link LifetimeScope} from
 * {@link #beginScope()}.
 */
public class DependencyContainer implements DependencyRepository {

    @Getter
    private final ContainerSettings settings;
    private final RegistrationStore store;
    private final InjectionEngine injectionEngine;
    private final List<InstanceInterceptor> interceptors = new CopyOnWriteArrayList<>();
    private final Set<Module> loadedModules = Collections.newSetFromMap(new IdentityHashMap<>());
    private final ThreadLocal<ResolutionStack> resolutionStack = ThreadLocal.withInitial(ResolutionStack::new);

    public DependencyContainer() {
        this(ContainerSettings.fromEnvironment());
    }

    public DependencyContainer(@NotNull ContainerSettings settings) {
        this.settings = settings;
        this.store = new RegistrationStore(settings.isCacheClosedGenerics());
        this.injectionEngine = new InjectionEngine(this);
        registerInstance(DependencyRepository.class, this);
        registerInstance(DependencyContainer.class, this);
    }

    // Registration

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation) {
        register(service, implementation, Lifetime.TRANSIENT);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime) {
        registerType(TypeKey.of(service), implementation, lifetime, null);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull Class<? extends S> implementation, @NotNull Lifetime lifetime, @NotNull Object key) {
        requireKey(service, key);
        registerType(TypeKey.of(service), implementation, lifetime, key);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime) {
        registerType(service, implementation, lifetime, null);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull Class<?> implementation, @NotNull Lifetime lifetime, @NotNull Object key) {
        requireKey(service.getType(), key);
        registerType(service, implementation, lifetime, key);
    }

    @Override
    public <S> void registerInstance(@NotNull Class<S> service, @NotNull S instance) {
        registerInstance(TypeKey.of(service), instance);
    }

    @Override
    public <S> void registerInstance(@NotNull TypeKey<S> service, @NotNull S instance) {
        if (instance == null) {
            throw new ConfigurationException(service.getType(), "Instance registered for " + service.getDisplayName() + " must not be null");
        }
        if (!service.getRawType().isInstance(instance)) {
            throw new ConfigurationException(service.getType(), "Instance of " + instance.getClass().getName()
                    + " is not assignable to " + service.getDisplayName());
        }
        store.register(service, Registration.forInstance(service, instance), null);
    }

    @Override
    public <S> void register(@NotNull Class<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime) {
        register(TypeKey.of(service), factory, lifetime);
    }

    @Override
    public <S> void register(@NotNull TypeKey<S> service, @NotNull RegistrationFactory<? extends S> factory, @NotNull Lifetime lifetime) {
        if (factory == null) {
            throw new ConfigurationException(service.getType(), "Factory registered for " + service.getDisplayName() + " must not be null");
        }
        store.register(service, Registration.forFactory(service, factory, requireLifetime(service.getType(), lifetime)), null);
    }

    private void registerType(TypeKey<?> service, Class<?> implementation, Lifetime lifetime, @Nullable Object key) {
        Type serviceType = service.getType();
        if (implementation == null) {
            throw new ConfigurationException(serviceType, "Implementation registered for " + service.getDisplayName() + " must not be null");
        }
        if (!service.getRawType().isAssignableFrom(implementation)) {
            throw new ConfigurationException(serviceType, "Implementation " + implementation.getName()
                    + " is not assignable to service " + service.getDisplayName());
        }
        if (!DependencyUtils.isConcreteClass(implementation)) {
            throw new ConfigurationException(serviceType, "Implementation " + implementation.getName()
                    + " of service " + service.getDisplayName() + " must be a concrete class");
        }

        Type implementationType = implementation;
        // Repository<Customer> -> JdbcRepository<T> closes the implementation over the same arguments
        if (Types.isClosedGeneric(serviceType) && Types.isOpenGeneric(implementation)) {
            int implementationArity = implementation.getTypeParameters().length;
            if (implementationArity != service.getTypeArguments().length) {
                throw new ConfigurationException(serviceType, "Implementation " + implementation.getName()
                        + " declares " + implementationArity + " type parameters but service " + service.getDisplayName()
                        + " is closed over " + service.getTypeArguments().length);
            }
            implementationType = Types.parameterized(implementation, service.getTypeArguments());
        }

        Registration registration = Registration.forType(service, implementationType, requireLifetime(serviceType, lifetime));
        store.register(service, registration, key);
        if (!Types.isOpenGeneric(implementationType)) {
            registration.getConstructionPlan();
        }
    }

    private static void requireKey(Type serviceType, Object key) {
        if (key == null) {
            throw new ConfigurationException(serviceType, "Key for keyed registration of " + Types.getDisplayName(serviceType) + " must not be null");
        }
    }

    private static Lifetime requireLifetime(Type serviceType, Lifetime lifetime) {
        if (lifetime == null) {
            throw new ConfigurationException(serviceType, "Lifetime for " + Types.getDisplayName(serviceType) + " must not be null");
        }
        return lifetime;
    }

    /**
     * Register every concrete class of the source accepted by the predicate under the interfaces it implements.
     * Interfaces that already have an unkeyed registration are left alone, so the first class wins.
     *
     * <p>A generic class is registered under the open generic interfaces it passes its own type parameters to,
     * e.g. {@code JdbcRepository<T> implements Repository<T>}. A non-generic class is registered under the exact
     * interface types, so {@code CustomerRepository implements Repository<Customer>} serves only
     * {@code Repository<Customer>}.
     *
     * @param source The classes to inspect
     * @param predicate Filter applied to each concrete class
     */
    public void registerAssemblyTypes(@NotNull TypeSource source, @NotNull Predicate<Class<?>> predicate) {
        int registered = 0;
        for (Class<?> clazz : source.getTypes()) {
            if (!DependencyUtils.isConcreteClass(clazz) || clazz.isEnum() || !predicate.test(clazz)) {
                continue;
            }
            boolean generic = clazz.getTypeParameters().length > 0;
            for (Type serviceType : DependencyUtils.getAllInterfaces(clazz)) {
                TypeKey<?> service;
                if (generic) {
                    if (!DependencyUtils.isPositionallyBound(serviceType, clazz)) {
                        continue;
                    }
                    service = TypeKey.of(Types.getRawType(serviceType));
                } else {
                    if (Types.isOpenGeneric(serviceType)) {
                        // raw use of a generic interface, e.g. implements Comparable
                        continue;
                    }
                    service = TypeKey.ofType(serviceType);
                }
                Registration registration = Registration.forType(service, clazz, Lifetime.TRANSIENT);
                if (store.registerIfAbsent(service, registration)) {
                    registered++;
                }
            }
        }
        DebugLogger.log(DependencyContainer.class, "Registered %d assembly type mappings", registered);
    }

    /**
     * Load the registrations of a module. A module instance is loaded at most once per container.
     */
    public void registerModule(@NotNull Module module) {
        synchronized (loadedModules) {
            if (!loadedModules.add(module)) {
                DebugLogger.log(DependencyContainer.class, "Module %s already loaded, skipping", module.getClass().getName());
                return;
            }
        }
        DebugLogger.log(DependencyContainer.class, "Loading module %s", module.getClass().getName());
        module.load(this);
    }

    public void addInterceptor(@NotNull InstanceInterceptor interceptor) {
        interceptors.add(interceptor);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> service) {
        return store.isRegistered(TypeKey.of(service));
    }

    public boolean isRegistered(@NotNull TypeKey<?> service) {
        return store.isRegistered(service);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> service, @NotNull Object key) {
        return store.isRegistered(TypeKey.of(service), key);
    }

    // Resolution

    public LifetimeScope beginScope() {
        return new LifetimeScope(this);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service) {
        return resolve(TypeKey.of(service));
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service) {
        return (T) resolve(service, null, null, null);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Object key) {
        return resolve(TypeKey.of(service), key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Object key) {
        requireKey(service.getType(), key);
        return (T) resolve(service, null, key, null);
    }

    @Override
    public @NotNull <T> T resolve(@NotNull Class<T> service, @NotNull Map<String, ?> overrides) {
        return resolve(TypeKey.of(service), overrides);
    }

    @Override
    @SuppressWarnings("unchecked")
    public @NotNull <T> T resolve(@NotNull TypeKey<T> service, @NotNull Map<String, ?> overrides) {
        return (T) resolve(service, null, null, overrides);
    }

    @Override
    public @NotNull <T> List<T> resolveAll(@NotNull Class<T> service) {
        return resolveAll(service, null);
    }

    @SuppressWarnings("unchecked")
    <T> List<T> resolveAll(@NotNull Class<T> service, @Nullable LifetimeScope scope) {
        return (List<T>) resolve(TypeKey.ofType(Types.parameterized(List.class, service)), scope, null, null);
    }

    /**
     * Inject {@code @Inject} fields and setters of an object created outside the container.
     */
    public void inject(@NotNull Object object) {
        injectionEngine.inject(object);
    }

    /**
     * Resolve a service.
     *
     * @param service The service to resolve
     * @param scope The scope scoped services are cached in, null outside a scope
     * @param key Registration key, null for the unkeyed registration
     * @param overrides Constructor arguments by parameter name, applied to the requested service only
     * @return The instance
     * @throws NotRegisteredException if nothing can provide the service
     */
    @NotNull
    public Object resolve(@NotNull TypeKey<?> service, @Nullable LifetimeScope scope, @Nullable Object key,
                          @Nullable Map<String, ?> overrides) {
        if (scope != null && scope.isClosed() && settings.isStrictScopeClose()) {
            throw new LifetimeViolationException(service.getType(), "Cannot resolve " + service.getDisplayName()
                    + " through a closed lifetime scope");
        }

        if (key != null) {
            Registration registration = store.lookupKeyed(service, key);
            if (registration == null) {
                if (!store.hasKeyedRegistrations(service)) {
                    throw new NotRegisteredException(service.getType(), "No keyed registrations found for service type '"
                            + service.getDisplayName() + "'.");
                }
                throw new NotRegisteredException(service.getType(), "No registration found for service type '"
                        + service.getDisplayName() + "' with key '" + key + "'.");
            }
            return resolveRegistration(registration, scope, overrides);
        }

        Registration registration = store.lookupRegistered(service);
        if (registration == null) {
            Type elementType = Types.getSequenceElementType(service.getType());
            if (elementType != null) {
                return resolveSequence(TypeKey.ofType(elementType), scope);
            }
            registration = store.lookup(service);
        }
        if (registration == null) {
            throw new NotRegisteredException(service.getType(), "Service type '" + service.getDisplayName() + "' is not registered.");
        }
        return resolveRegistration(registration, scope, overrides);
    }

    private List<Object> resolveSequence(TypeKey<?> element, @Nullable LifetimeScope scope) {
        List<Object> instances = new ArrayList<>();
        Registration unkeyed = store.lookupRegistered(element);
        if (unkeyed != null) {
            instances.add(resolveRegistration(unkeyed, scope, null));
        }
        for (Registration registration : store.getKeyedRegistrations(element)) {
            instances.add(resolveRegistration(registration, scope, null));
        }
        DebugLogger.log(DependencyContainer.class, "Resolved %d instances of %s", instances.size(), element.getDisplayName());
        return Collections.unmodifiableList(instances);
    }

    private Object resolveRegistration(Registration registration, @Nullable LifetimeScope scope, @Nullable Map<String, ?> overrides) {
        switch (registration.getLifetime()) {
            case SINGLETON -> {
                Object instance = registration.getSingletonInstance();
                if (instance != null) {
                    return instance;
                }
                synchronized (registration) {
                    if (!registration.hasSingletonInstance()) {
                        registration.setSingletonInstance(construct(registration, scope, overrides));
                        DebugLogger.log(DependencyContainer.class, "Created singleton %s", registration);
                    }
                    return registration.getSingletonInstance();
                }
            }
            case SCOPED -> {
                if (scope == null) {
                    throw new LifetimeViolationException(registration.getServiceType().getType(), "Cannot resolve scoped service '"
                            + registration.getServiceType().getDisplayName() + "' without a lifetime scope.");
                }
                Object instance = scope.getScopedInstance(registration);
                if (instance != null) {
                    return instance;
                }
                return scope.computeScopedInstance(registration, () -> {
                    Object created = construct(registration, scope, overrides);
                    DebugLogger.log(DependencyContainer.class, "Created scoped %s", registration);
                    return created;
                });
            }
            default -> {
                return construct(registration, scope, overrides);
            }
        }
    }

    private Object construct(Registration registration, @Nullable LifetimeScope scope, @Nullable Map<String, ?> overrides) {
        ResolutionStack stack = resolutionStack.get();
        stack.push(registration);
        try {
            return createInstance(registration, scope, overrides);
        } finally {
            stack.pop(registration);
            if (stack.isEmpty()) {
                resolutionStack.remove();
            }
        }
    }

    private Object createInstance(Registration registration, @Nullable LifetimeScope scope, @Nullable Map<String, ?> overrides) {
        Type serviceType = registration.getServiceType().getType();
        if (registration.isFactoryBacked()) {
            Object instance;
            try {
                instance = registration.getFactory().create(scope != null ? scope : this);
            } catch (DependencyContainerException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ConstructionException(serviceType, "Factory for " + registration.getServiceType().getDisplayName()
                        + " threw an exception", e);
            }
            if (instance == null) {
                throw new ConstructionException(serviceType, "Factory for " + registration.getServiceType().getDisplayName()
                        + " returned null");
            }
            return intercept(registration, instance);
        }

        ConstructionPlan plan = registration.getConstructionPlan();
        List<ConstructionPlan.ConstructorParameter> parameters = plan.getParameters();
        Object[] arguments = new Object[parameters.size()];
        for (int i = 0; i < parameters.size(); i++) {
            ConstructionPlan.ConstructorParameter parameter = parameters.get(i);
            if (overrides != null && overrides.containsKey(parameter.getName())) {
                arguments[i] = overrides.get(parameter.getName());
            } else {
                arguments[i] = resolve(TypeKey.ofType(parameter.getType()), scope, null, null);
            }
        }
        Object instance = plan.newInstance(arguments);
        injectionEngine.inject(instance, plan, scope);
        return intercept(registration, instance);
    }

    private Object intercept(Registration registration, Object instance) {
        Object result = instance;
        for (InstanceInterceptor interceptor : interceptors) {
            result = interceptor.intercept(registration, result);
            if (result == null) {
                throw new ConstructionException(registration.getServiceType().getType(), "Interceptor "
                        + interceptor.getClass().getName() + " returned null for " + registration.getServiceType().getDisplayName());
            }
        }
        return result;
    }
}
