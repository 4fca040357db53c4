package net.vortexdevelopment.vwire.di.utils;

import net.vortexdevelopment.vwire.di.TypeKey;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyUtilsTest {

    @Test
    void concreteClassesAreImplicitlyConstructible() {
        assertThat(DependencyUtils.isImplicitlyConstructible(Engine.class)).isTrue();
        assertThat(DependencyUtils.isImplicitlyConstructible(new TypeKey<Holder<String>>() {}.getType())).isTrue();
    }

    @Test
    void nonConstructibleTypesAreRejected() {
        assertThat(DependencyUtils.isImplicitlyConstructible(Vehicle.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(AbstractVehicle.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(int.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(String[].class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(Color.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(String.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(Long.class)).isFalse();
        assertThat(DependencyUtils.isImplicitlyConstructible(Holder.class)).isTrue();
        assertThat(DependencyUtils.isImplicitlyConstructible(new TypeKey<List<String>>() {}.getType())).isFalse();
    }

    @Test
    void interfacesAreCollectedThroughTheHierarchy() {
        Set<Type> interfaces = DependencyUtils.getAllInterfaces(Truck.class);

        assertThat(interfaces).contains(Heavy.class, Vehicle.class, new TypeKey<Loadable<Cargo>>() {}.getType());
    }

    @Test
    void superClassBindingsAreAppliedToInterfaces() {
        Set<Type> interfaces = DependencyUtils.getAllInterfaces(Freighter.class);

        assertThat(interfaces).contains(new TypeKey<Loadable<Cargo>>() {}.getType());
    }

    @Test
    void positionalBindingRequiresOwnTypeParametersInOrder() {
        Type forwarded = Trailer.class.getGenericInterfaces()[0];
        Type fixed = SwappedTrailer.class.getGenericInterfaces()[0];

        assertThat(DependencyUtils.isPositionallyBound(forwarded, Trailer.class)).isTrue();
        assertThat(DependencyUtils.isPositionallyBound(fixed, SwappedTrailer.class)).isFalse();
        assertThat(DependencyUtils.isPositionallyBound(Vehicle.class, Trailer.class)).isFalse();
    }

    public interface Vehicle {
    }

    public interface Heavy extends Vehicle {
    }

    public interface Loadable<T> {
    }

    public interface Coupling<A, B> {
    }

    public static class Cargo {
    }

    public static class Engine {
    }

    public static class Holder<T> {
    }

    public enum Color {
        RED
    }

    public abstract static class AbstractVehicle implements Vehicle {
    }

    public static class Truck extends AbstractVehicle implements Heavy, Loadable<Cargo> {
    }

    public static class Carrier<T> implements Loadable<T> {
    }

    public static class Freighter extends Carrier<Cargo> {
    }

    public static class Trailer<A, B> implements Coupling<A, B> {
    }

    public static class SwappedTrailer<A, B> implements Coupling<B, A> {
    }
}
