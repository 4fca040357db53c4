package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;

/**
 * Thrown when no registration exists for a service and none can be synthesized.
 */
public class NotRegisteredException extends DependencyContainerException {

    public NotRegisteredException(Type serviceType, String message) {
        super(serviceType, message);
    }

    public NotRegisteredException(Type serviceType, String message, Throwable cause) {
        super(serviceType, message, cause);
    }
}
