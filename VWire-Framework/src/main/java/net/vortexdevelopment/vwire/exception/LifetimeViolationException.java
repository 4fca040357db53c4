package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;

/**
 * Thrown when a scoped service is resolved without an active lifetime scope.
 */
public class LifetimeViolationException extends DependencyContainerException {

    public LifetimeViolationException(Type serviceType, String message) {
        super(serviceType, message);
    }

    public LifetimeViolationException(Type serviceType, String message, Throwable cause) {
        super(serviceType, message, cause);
    }
}
