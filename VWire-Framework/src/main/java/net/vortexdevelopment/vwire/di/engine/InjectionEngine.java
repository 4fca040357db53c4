package net.vortexdevelopment.vwire.di.engine;

import net.vortexdevelopment.vwire.di.DependencyContainer;
import net.vortexdevelopment.vwire.di.LifetimeScope;
import net.vortexdevelopment.vwire.di.TypeKey;
import net.vortexdevelopment.vwire.exception.DependencyContainerException;
import net.vortexdevelopment.vwire.exception.PropertyInjectionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handles dependency injection into {@code @Inject} fields and setters.
 */
public class InjectionEngine {

    private final DependencyContainer container;
    private final Map<Class<?>, ConstructionPlan> externalPlans = new ConcurrentHashMap<>();

    public InjectionEngine(DependencyContainer container) {
        this.container = container;
    }

    /**
     * Injects dependencies into an object the container did not create.
     *
     * @param object The instance to inject dependencies into
     */
    public void inject(@NotNull Object object) {
        ConstructionPlan plan = externalPlans.computeIfAbsent(object.getClass(), ConstructionPlan::of);
        inject(object, plan, null);
    }

    /**
     * Resolve and assign every injection point of the plan, in plan order.
     *
     * @param object The freshly constructed instance
     * @param plan The plan the instance was built from
     * @param scope The lifetime scope of the surrounding resolve call, may be null
     * @throws PropertyInjectionException if a dependency cannot be resolved or assigned
     */
    public void inject(@NotNull Object object, @NotNull ConstructionPlan plan, @Nullable LifetimeScope scope) {
        for (InjectionPoint injectionPoint : plan.getInjectionPoints()) {
            Object value;
            try {
                value = container.resolve(TypeKey.ofType(injectionPoint.getTargetType()), scope, null, null);
            } catch (PropertyInjectionException e) {
                throw e;
            } catch (DependencyContainerException e) {
                throw new PropertyInjectionException(injectionPoint.getTargetType(), "Unable to resolve "
                        + injectionPoint.getTargetType().getTypeName() + " for " + injectionPoint.getDescription()
                        + " in class: " + object.getClass().getName(), e);
            }
            injectionPoint.inject(object, value);
        }
    }
}
