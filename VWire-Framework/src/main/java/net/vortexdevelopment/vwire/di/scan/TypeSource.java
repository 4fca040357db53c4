package net.vortexdevelopment.vwire.di.scan;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Supplies candidate classes for {@link net.vortexdevelopment.vwire.di.DependencyContainer#registerAssemblyTypes}.
 * The iteration order of {@link #getTypes()} decides which class wins when two implement the same interface.
 */
@FunctionalInterface
public interface TypeSource {

    @NotNull
    Collection<Class<?>> getTypes();

    /**
     * A fixed list of classes, kept in the given order.
     */
    static TypeSource of(Class<?>... types) {
        List<Class<?>> list = List.of(types);
        return () -> list;
    }
}
