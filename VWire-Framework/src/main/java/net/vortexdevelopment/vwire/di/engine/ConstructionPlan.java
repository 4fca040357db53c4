package net.vortexdevelopment.vwire.di.engine;

import lombok.Getter;
import net.vortexdevelopment.vwire.annotation.Inject;
import net.vortexdevelopment.vwire.di.utils.Types;
import net.vortexdevelopment.vwire.exception.ConstructionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reflection metadata needed to build one implementation type: the selected constructor with its parameter types,
 * and every {@link Inject} field and setter. Computed once per implementation type.
 *
 * <p>Constructor selection: the public constructor with the most parameters. Among constructors with equal
 * parameter counts the one whose parameter type names sort first (compared name by name) wins.
 */
@Getter
public final class ConstructionPlan {

    private static final Comparator<Constructor<?>> CONSTRUCTOR_ORDER = Comparator
            .<Constructor<?>>comparingInt(Constructor::getParameterCount).reversed()
            .thenComparing(ConstructionPlan::parameterTypeNames, ConstructionPlan::compareNames);

    private final Type implementationType;
    @Nullable
    private final Constructor<?> constructor;
    private final List<ConstructorParameter> parameters;
    private final List<InjectionPoint> injectionPoints;

    private ConstructionPlan(Type implementationType, @Nullable Constructor<?> constructor,
                             List<ConstructorParameter> parameters, List<InjectionPoint> injectionPoints) {
        this.implementationType = implementationType;
        this.constructor = constructor;
        this.parameters = parameters;
        this.injectionPoints = injectionPoints;
    }

    /**
     * Build the plan for a class or a closed generic type. Type variables of a closed generic are substituted in
     * parameter, field and setter types.
     */
    public static ConstructionPlan of(@NotNull Type implementationType) {
        Class<?> rawType = Types.getRawType(implementationType);
        Map<Class<?>, Map<TypeVariable<?>, Type>> bindingsByClass = collectBindings(implementationType);
        Map<TypeVariable<?>, Type> bindings = bindingsByClass.getOrDefault(rawType, Map.of());

        Constructor<?> constructor = selectConstructor(rawType);
        List<ConstructorParameter> parameters = new ArrayList<>();
        if (constructor != null) {
            for (Parameter parameter : constructor.getParameters()) {
                parameters.add(new ConstructorParameter(parameter.getName(),
                        Types.substitute(parameter.getParameterizedType(), bindings)));
            }
        }

        return new ConstructionPlan(implementationType, constructor,
                Collections.unmodifiableList(parameters),
                Collections.unmodifiableList(collectInjectionPoints(rawType, bindingsByClass)));
    }

    @Nullable
    private static Constructor<?> selectConstructor(Class<?> rawType) {
        return Arrays.stream(rawType.getConstructors())
                .min(CONSTRUCTOR_ORDER)
                .orElse(null);
    }

    private static List<String> parameterTypeNames(Constructor<?> constructor) {
        return Arrays.stream(constructor.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.toList());
    }

    private static int compareNames(List<String> left, List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int result = left.get(i).compareTo(right.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    /**
     * Type variable bindings of every class in the hierarchy, so inherited members see the concrete types.
     */
    private static Map<Class<?>, Map<TypeVariable<?>, Type>> collectBindings(Type implementationType) {
        Map<Class<?>, Map<TypeVariable<?>, Type>> bindingsByClass = new HashMap<>();
        Type current = implementationType;
        Map<TypeVariable<?>, Type> currentBindings = Map.of();
        while (current != null) {
            Type resolved = Types.substitute(current, currentBindings);
            Class<?> rawType = Types.getRawType(resolved);
            if (rawType == Object.class) {
                break;
            }
            currentBindings = Types.getTypeBindings(resolved);
            bindingsByClass.put(rawType, currentBindings);
            current = rawType.getGenericSuperclass();
        }
        return bindingsByClass;
    }

    /**
     * Fields first, then setters; super classes before subclasses. A setter overridden further down the hierarchy
     * is injected once, through the most derived override.
     */
    private static List<InjectionPoint> collectInjectionPoints(Class<?> rawType, Map<Class<?>, Map<TypeVariable<?>, Type>> bindingsByClass) {
        LinkedList<Class<?>> hierarchy = new LinkedList<>();
        for (Class<?> clazz = rawType; clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
            hierarchy.addFirst(clazz);
        }

        List<InjectionPoint> fields = new ArrayList<>();
        for (Class<?> clazz : hierarchy) {
            Map<TypeVariable<?>, Type> bindings = bindingsByClass.getOrDefault(clazz, Map.of());
            for (Field field : clazz.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || Modifier.isFinal(field.getModifiers())
                        || !field.isAnnotationPresent(Inject.class)) {
                    continue;
                }
                fields.add(InjectionPoint.forField(field, Types.substitute(field.getGenericType(), bindings)));
            }
        }

        // Walk from the most derived class up so overrides are seen before the methods they override
        Set<String> injectableSignatures = new HashSet<>();
        Set<String> seenSignatures = new HashSet<>();
        Map<String, Method> mostDerived = new HashMap<>();
        List<String> order = new ArrayList<>();
        for (Class<?> clazz = rawType; clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
            for (Method method : clazz.getDeclaredMethods()) {
                if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 1
                        || method.isBridge() || method.isSynthetic()) {
                    continue;
                }
                String signature = method.getName() + "(" + method.getParameterTypes()[0].getName() + ")";
                if (seenSignatures.add(signature)) {
                    mostDerived.put(signature, method);
                }
                if (method.isAnnotationPresent(Inject.class) && injectableSignatures.add(signature)) {
                    order.add(0, signature);
                }
            }
        }

        List<InjectionPoint> setters = new ArrayList<>();
        for (String signature : order) {
            Method method = mostDerived.get(signature);
            Map<TypeVariable<?>, Type> bindings = bindingsByClass.getOrDefault(method.getDeclaringClass(), Map.of());
            setters.add(InjectionPoint.forSetter(method, Types.substitute(method.getGenericParameterTypes()[0], bindings)));
        }

        List<InjectionPoint> injectionPoints = new ArrayList<>(fields);
        injectionPoints.addAll(setters);
        return injectionPoints;
    }

    /**
     * Invoke the selected constructor.
     *
     * @throws ConstructionException if there is no public constructor or the constructor fails
     */
    @NotNull
    public Object newInstance(@NotNull Object[] arguments) {
        if (constructor == null) {
            throw new ConstructionException(implementationType, "No public constructors found for type '"
                    + implementationType.getTypeName() + "'.");
        }
        try {
            constructor.setAccessible(true);
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw new ConstructionException(implementationType, "Constructor of " + implementationType.getTypeName()
                    + " threw an exception", e.getTargetException());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new ConstructionException(implementationType, "Unable to create new instance of class: "
                    + implementationType.getTypeName(), e);
        }
    }

    /**
     * A constructor parameter with its type as seen from the closed implementation type.
     */
    @Getter
    public static final class ConstructorParameter {
        private final String name;
        private final Type type;

        ConstructorParameter(String name, Type type) {
            this.name = name;
            this.type = type;
        }
    }
}
