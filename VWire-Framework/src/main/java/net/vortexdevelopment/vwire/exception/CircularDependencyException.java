package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;
import java.util.List;

/**
 * Thrown when a registration depends on itself, directly or through other registrations.
 */
public class CircularDependencyException extends DependencyContainerException {

    private final List<String> path;

    public CircularDependencyException(Type serviceType, List<String> path) {
        super(serviceType, "Circular dependency detected: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    /**
     * @return the display names along the cycle; first and last entry are the same
     */
    public List<String> getPath() {
        return path;
    }
}
