package net.vortexdevelopment.vwire.di.utils;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Utility class for common reflection operations in VWire.
 */
public final class DependencyUtils {

    private static final Set<Class<?>> VALUE_TYPES = Set.of(
            String.class, Boolean.class, Byte.class, Character.class, Short.class,
            Integer.class, Long.class, Float.class, Double.class, Void.class, Class.class);

    private DependencyUtils() {
    }

    /**
     * Whether the container may build the type without a registration: a concrete class or a closed generic over one.
     * Primitives, arrays, enums and JDK value types are excluded, they have to be registered or overridden.
     */
    public static boolean isImplicitlyConstructible(@NotNull Type type) {
        if (!(type instanceof Class<?>) && !Types.isClosedGeneric(type)) {
            return false;
        }
        Class<?> rawType = Types.getRawType(type);
        return !rawType.isInterface()
                && !rawType.isPrimitive()
                && !rawType.isArray()
                && !rawType.isEnum()
                && !rawType.isAnnotation()
                && !Modifier.isAbstract(rawType.getModifiers())
                && !VALUE_TYPES.contains(rawType);
    }

    public static boolean isConcreteClass(@NotNull Class<?> clazz) {
        return !clazz.isInterface() && !clazz.isPrimitive() && !clazz.isArray()
                && !Modifier.isAbstract(clazz.getModifiers());
    }

    /**
     * Collects every interface a class implements, including super-interfaces and those of super classes.
     * Generic interfaces come back with the class's own type variables substituted where the hierarchy binds them,
     * e.g. {@code CustomerRepository extends JdbcRepository<Customer>} yields {@code Repository<Customer>}.
     *
     * @param clazz The class to inspect
     * @return The interfaces in discovery order, nearest first
     */
    @NotNull
    public static Set<Type> getAllInterfaces(@NotNull Class<?> clazz) {
        Set<Type> interfaces = new LinkedHashSet<>();
        collectInterfaces(clazz, Map.of(), interfaces);
        return interfaces;
    }

    private static void collectInterfaces(Class<?> clazz, Map<TypeVariable<?>, Type> bindings, Set<Type> interfaces) {
        for (Type genericInterface : clazz.getGenericInterfaces()) {
            Type resolved = Types.substitute(genericInterface, bindings);
            if (interfaces.add(resolved)) {
                collectInterfaces(Types.getRawType(resolved), Types.getTypeBindings(resolved), interfaces);
            }
        }
        Type superclass = clazz.getGenericSuperclass();
        if (superclass != null && superclass != Object.class) {
            Type resolved = Types.substitute(superclass, bindings);
            collectInterfaces(Types.getRawType(resolved), Types.getTypeBindings(resolved), interfaces);
        }
    }

    /**
     * Check that a generic interface is parameterized by exactly the type variables of {@code implementation}, in order.
     * Only such interfaces can be closed positionally together with the implementation.
     */
    public static boolean isPositionallyBound(@NotNull Type genericInterface, @NotNull Class<?> implementation) {
        if (!(genericInterface instanceof ParameterizedType parameterizedType)) {
            return false;
        }
        Type[] arguments = parameterizedType.getActualTypeArguments();
        TypeVariable<?>[] variables = implementation.getTypeParameters();
        if (arguments.length != variables.length) {
            return false;
        }
        for (int i = 0; i < arguments.length; i++) {
            if (!variables[i].equals(arguments[i])) {
                return false;
            }
        }
        return true;
    }
}
