package net.vortexdevelopment.vwire.di.registry;

import lombok.AccessLevel;
import lombok.Getter;
import net.vortexdevelopment.vwire.di.TypeKey;
import net.vortexdevelopment.vwire.di.engine.ConstructionPlan;
import net.vortexdevelopment.vwire.di.utils.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;

/**
 * Describes how to produce one service: implementation type or factory, lifetime, and the singleton slot.
 *
 * <p>Registrations compare by identity. Scoped instances are cached per registration object.
 */
@Getter
public final class Registration {

    public enum Origin {
        /** Mapped to an implementation class by a register call. */
        EXPLICIT,
        /** Pre-built instance. */
        INSTANCE,
        /** Factory callback. */
        FACTORY,
        /** Concrete class resolved without being registered. */
        IMPLICIT,
        /** Closed from an open generic registration on lookup. */
        CLOSED_GENERIC
    }

    private final TypeKey<?> serviceType;
    @Nullable
    private final Type implementationType;
    private final Lifetime lifetime;
    @Nullable
    private final RegistrationFactory<?> factory;
    private final Origin origin;

    @Getter(AccessLevel.NONE)
    private volatile Object singletonInstance;
    @Getter(AccessLevel.NONE)
    private volatile ConstructionPlan constructionPlan;

    private Registration(TypeKey<?> serviceType, @Nullable Type implementationType, Lifetime lifetime,
                         @Nullable RegistrationFactory<?> factory, Origin origin) {
        this.serviceType = serviceType;
        this.implementationType = implementationType;
        this.lifetime = lifetime;
        this.factory = factory;
        this.origin = origin;
    }

    public static Registration forType(@NotNull TypeKey<?> serviceType, @NotNull Type implementationType, @NotNull Lifetime lifetime) {
        return new Registration(serviceType, implementationType, lifetime, null, Origin.EXPLICIT);
    }

    public static Registration forInstance(@NotNull TypeKey<?> serviceType, @NotNull Object instance) {
        Registration registration = new Registration(serviceType, serviceType.getType(), Lifetime.SINGLETON, null, Origin.INSTANCE);
        registration.singletonInstance = instance;
        return registration;
    }

    public static Registration forFactory(@NotNull TypeKey<?> serviceType, @NotNull RegistrationFactory<?> factory, @NotNull Lifetime lifetime) {
        return new Registration(serviceType, null, lifetime, factory, Origin.FACTORY);
    }

    public static Registration implicit(@NotNull TypeKey<?> serviceType) {
        return new Registration(serviceType, serviceType.getType(), Lifetime.TRANSIENT, null, Origin.IMPLICIT);
    }

    /**
     * Close this open generic registration over the type arguments of {@code closedService}.
     * The result shares nothing with this registration except its lifetime.
     */
    public Registration close(@NotNull TypeKey<?> closedService) {
        if (!isClosable()) {
            throw new IllegalStateException("Registration for " + serviceType + " is not an open generic type mapping");
        }
        Type closedImplementation = Types.parameterized((Class<?>) implementationType, closedService.getTypeArguments());
        return new Registration(closedService, closedImplementation, lifetime, null, Origin.CLOSED_GENERIC);
    }

    /**
     * @return true if this maps an open generic service onto an open generic implementation
     */
    public boolean isClosable() {
        return origin == Origin.EXPLICIT && implementationType != null && Types.isOpenGeneric(implementationType);
    }

    public boolean isFactoryBacked() {
        return factory != null;
    }

    public boolean hasSingletonInstance() {
        return singletonInstance != null;
    }

    @Nullable
    public Object getSingletonInstance() {
        return singletonInstance;
    }

    /**
     * Store the constructed singleton. Only the first value sticks.
     */
    public void setSingletonInstance(@NotNull Object instance) {
        if (singletonInstance == null) {
            singletonInstance = instance;
        }
    }

    /**
     * Reflection metadata used to build instances of the implementation type, computed once.
     */
    @NotNull
    public ConstructionPlan getConstructionPlan() {
        ConstructionPlan plan = constructionPlan;
        if (plan == null) {
            if (implementationType == null) {
                throw new IllegalStateException("Factory registration for " + serviceType + " has no construction plan");
            }
            plan = ConstructionPlan.of(implementationType);
            constructionPlan = plan;
        }
        return plan;
    }

    @Override
    public String toString() {
        return "Registration{" + serviceType.getDisplayName()
                + " -> " + (implementationType != null ? Types.getDisplayName(implementationType) : "factory")
                + ", " + lifetime + ", " + origin + "}";
    }
}
