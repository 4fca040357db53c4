package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;

/**
 * Thrown when an implementation cannot be instantiated.
 */
public class ConstructionException extends DependencyContainerException {

    public ConstructionException(Type serviceType, String message) {
        super(serviceType, message);
    }

    public ConstructionException(Type serviceType, String message, Throwable cause) {
        super(serviceType, message, cause);
    }
}
