package net.vortexdevelopment.vwire.di;

import net.vortexdevelopment.vwire.di.utils.Types;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Identity of a service as the container sees it.
 *
 * <p>Plain classes are wrapped with {@link #of(Class)}. Parameterized types are captured with an
 * anonymous subclass:
 * <pre>
 * {@code
 * TypeKey<Repository<Customer>> key = new TypeKey<Repository<Customer>>() {};
 * }
 * </pre>
 *
 * @param <T> The service type
 */
public abstract class TypeKey<T> {

    @NotNull
    private final Type type;

    protected TypeKey() {
        this.type = getSuperclassTypeParameter(getClass());
    }

    private TypeKey(@NotNull Type type) {
        this.type = type;
    }

    private static <T> TypeKey<T> create(Type type) {
        return new TypeKey<T>(type) {};
    }

    @NotNull
    public static <T> TypeKey<T> of(@NotNull Class<T> type) {
        return create(type);
    }

    @NotNull
    public static <T> TypeKey<T> ofType(@NotNull Type type) {
        return create(type);
    }

    @NotNull
    private static Type getSuperclassTypeParameter(@NotNull Class<?> subclass) {
        Type superclass = subclass.getGenericSuperclass();
        if (superclass instanceof ParameterizedType parameterizedType) {
            return parameterizedType.getActualTypeArguments()[0];
        }
        throw new IllegalArgumentException("TypeKey must be created with a type argument, got: " + superclass);
    }

    @NotNull
    public Type getType() {
        return type;
    }

    @SuppressWarnings("unchecked")
    @NotNull
    public Class<T> getRawType() {
        return (Class<T>) Types.getRawType(type);
    }

    public Type[] getTypeArguments() {
        return Types.getTypeArguments(type);
    }

    public boolean isOpenGeneric() {
        return Types.isOpenGeneric(type);
    }

    public boolean isClosedGeneric() {
        return Types.isClosedGeneric(type);
    }

    public String getDisplayName() {
        return Types.getDisplayName(type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeKey<?> other)) {
            return false;
        }
        return type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.getTypeName();
    }
}
