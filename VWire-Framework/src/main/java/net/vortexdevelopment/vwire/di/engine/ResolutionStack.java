package net.vortexdevelopment.vwire.di.engine;

import net.vortexdevelopment.vwire.di.registry.Registration;
import net.vortexdevelopment.vwire.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registrations currently under construction on one thread, in the order they were entered.
 * Entering a registration that is already on the stack means the dependency graph has a cycle.
 *
 * <p>Explicit registrations are tracked by identity. Synthesized ones are tracked by their service type since a
 * container that does not cache them hands out a new registration on every lookup.
 */
public final class ResolutionStack {

    private final Map<Object, Registration> visiting = new LinkedHashMap<>();

    /**
     * @throws CircularDependencyException if the registration is already being constructed
     */
    public void push(@NotNull Registration registration) {
        Object frame = frameOf(registration);
        if (visiting.containsKey(frame)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (Map.Entry<Object, Registration> entry : visiting.entrySet()) {
                if (entry.getKey().equals(frame)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(entry.getValue().getServiceType().getDisplayName());
                }
            }
            cycle.add(registration.getServiceType().getDisplayName());
            throw new CircularDependencyException(registration.getServiceType().getType(), cycle);
        }
        visiting.put(frame, registration);
    }

    public void pop(@NotNull Registration registration) {
        visiting.remove(frameOf(registration));
    }

    public boolean isEmpty() {
        return visiting.isEmpty();
    }

    public int depth() {
        return visiting.size();
    }

    private static Object frameOf(Registration registration) {
        return switch (registration.getOrigin()) {
            case IMPLICIT, CLOSED_GENERIC -> registration.getServiceType();
            default -> new IdentityFrame(registration);
        };
    }

    private record IdentityFrame(Registration registration) {
        @Override
        public boolean equals(Object o) {
            return o instanceof IdentityFrame other && other.registration == registration;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(registration);
        }
    }
}
