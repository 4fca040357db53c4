package net.vortexdevelopment.vwire.di.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Helpers for working with {@link Type} instances: raw types, generic closing and type variable substitution.
 */
public final class Types {

    private static final List<Class<?>> SEQUENCE_TYPES = List.of(Iterable.class, Collection.class, List.class);

    private Types() {
    }

    @NotNull
    public static Class<?> getRawType(@NotNull Type type) {
        if (type instanceof Class<?> clazz) {
            return clazz;
        }
        if (type instanceof ParameterizedType parameterizedType) {
            return (Class<?>) parameterizedType.getRawType();
        }
        if (type instanceof GenericArrayType arrayType) {
            return Array.newInstance(getRawType(arrayType.getGenericComponentType()), 0).getClass();
        }
        throw new IllegalArgumentException("Cannot determine raw type of " + type.getTypeName());
    }

    /**
     * A raw class that declares type parameters, e.g. {@code Repository.class} for {@code Repository<T>}.
     */
    public static boolean isOpenGeneric(@NotNull Type type) {
        return type instanceof Class<?> clazz && clazz.getTypeParameters().length > 0;
    }

    /**
     * A parameterized type whose arguments are all concrete, e.g. {@code Repository<Customer>}.
     */
    public static boolean isClosedGeneric(@NotNull Type type) {
        return type instanceof ParameterizedType && isFullyResolved(type);
    }

    /**
     * Check that a type contains no type variables or wildcards.
     */
    public static boolean isFullyResolved(@NotNull Type type) {
        if (type instanceof Class<?>) {
            return true;
        }
        if (type instanceof ParameterizedType parameterizedType) {
            for (Type argument : parameterizedType.getActualTypeArguments()) {
                if (!isFullyResolved(argument)) {
                    return false;
                }
            }
            return true;
        }
        if (type instanceof GenericArrayType arrayType) {
            return isFullyResolved(arrayType.getGenericComponentType());
        }
        return false;
    }

    @NotNull
    public static Type[] getTypeArguments(@NotNull Type type) {
        if (type instanceof ParameterizedType parameterizedType) {
            return parameterizedType.getActualTypeArguments();
        }
        return new Type[0];
    }

    /**
     * Element type of {@code Iterable<T>}, {@code Collection<T>} or {@code List<T>}. A wildcard element such as
     * {@code ? extends T} yields its upper bound.
     *
     * @return the element type, or null if the type is not one of the sequence types
     */
    @Nullable
    public static Type getSequenceElementType(@NotNull Type type) {
        if (type instanceof ParameterizedType parameterizedType
                && SEQUENCE_TYPES.contains(parameterizedType.getRawType())) {
            Type element = parameterizedType.getActualTypeArguments()[0];
            if (element instanceof WildcardType wildcardType) {
                return wildcardType.getUpperBounds()[0];
            }
            return element;
        }
        return null;
    }

    /**
     * Close an open generic class over the given type arguments.
     */
    @NotNull
    public static ParameterizedType parameterized(@NotNull Class<?> rawType, @NotNull Type... arguments) {
        if (rawType.getTypeParameters().length != arguments.length) {
            throw new IllegalArgumentException("Expected " + rawType.getTypeParameters().length
                    + " type arguments for " + rawType.getName() + " but got " + arguments.length);
        }
        return new ParameterizedTypeImpl(rawType, arguments, rawType.getDeclaringClass());
    }

    /**
     * Map the type parameters of a class onto concrete arguments.
     * An open generic class maps onto {@code closedType}'s arguments positionally, anything else maps to nothing.
     */
    @NotNull
    public static Map<TypeVariable<?>, Type> getTypeBindings(@NotNull Type closedType) {
        Map<TypeVariable<?>, Type> bindings = new HashMap<>();
        if (closedType instanceof ParameterizedType parameterizedType) {
            TypeVariable<?>[] variables = getRawType(parameterizedType).getTypeParameters();
            Type[] arguments = parameterizedType.getActualTypeArguments();
            for (int i = 0; i < variables.length; i++) {
                bindings.put(variables[i], arguments[i]);
            }
        }
        return bindings;
    }

    /**
     * Replace type variables in {@code type} using the given bindings. Unbound variables stay as they are.
     */
    @NotNull
    public static Type substitute(@NotNull Type type, @NotNull Map<TypeVariable<?>, Type> bindings) {
        if (bindings.isEmpty()) {
            return type;
        }
        if (type instanceof TypeVariable<?> variable) {
            return bindings.getOrDefault(variable, variable);
        }
        if (type instanceof ParameterizedType parameterizedType) {
            Type[] arguments = parameterizedType.getActualTypeArguments().clone();
            boolean changed = false;
            for (int i = 0; i < arguments.length; i++) {
                Type substituted = substitute(arguments[i], bindings);
                changed |= substituted != arguments[i];
                arguments[i] = substituted;
            }
            if (!changed) {
                return type;
            }
            return new ParameterizedTypeImpl((Class<?>) parameterizedType.getRawType(), arguments, parameterizedType.getOwnerType());
        }
        if (type instanceof GenericArrayType arrayType) {
            Type component = substitute(arrayType.getGenericComponentType(), bindings);
            if (component instanceof Class<?> componentClass) {
                return Array.newInstance(componentClass, 0).getClass();
            }
            return type;
        }
        return type;
    }

    /**
     * Short display form, e.g. {@code Repository<Customer>} instead of fully qualified names.
     */
    @NotNull
    public static String getDisplayName(@NotNull Type type) {
        return type.getTypeName().replaceAll("(?:\\w+\\.)*(\\w+)", "$1").replace('$', '.');
    }

    private static final class ParameterizedTypeImpl implements ParameterizedType {
        private final Class<?> rawType;
        private final Type[] arguments;
        @Nullable
        private final Type ownerType;

        private ParameterizedTypeImpl(Class<?> rawType, Type[] arguments, @Nullable Type ownerType) {
            this.rawType = rawType;
            this.arguments = arguments;
            this.ownerType = ownerType;
        }

        @Override
        public Type[] getActualTypeArguments() {
            return arguments.clone();
        }

        @Override
        public Type getRawType() {
            return rawType;
        }

        @Override
        public Type getOwnerType() {
            return ownerType;
        }

        // Same contract as the JDK implementation so both can be mixed as map keys
        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ParameterizedType that)) {
                return false;
            }
            return Objects.equals(ownerType, that.getOwnerType())
                    && Objects.equals(rawType, that.getRawType())
                    && Arrays.equals(arguments, that.getActualTypeArguments());
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(arguments) ^ Objects.hashCode(ownerType) ^ Objects.hashCode(rawType);
        }

        @Override
        public String toString() {
            return rawType.getTypeName() + Arrays.stream(arguments)
                    .map(Type::getTypeName)
                    .collect(Collectors.joining(", ", "<", ">"));
        }
    }
}
