package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;

/**
 * Thrown when an {@code @Inject} field or setter cannot be populated.
 */
public class PropertyInjectionException extends DependencyContainerException {

    public PropertyInjectionException(Type serviceType, String message) {
        super(serviceType, message);
    }

    public PropertyInjectionException(Type serviceType, String message, Throwable cause) {
        super(serviceType, message, cause);
    }
}
