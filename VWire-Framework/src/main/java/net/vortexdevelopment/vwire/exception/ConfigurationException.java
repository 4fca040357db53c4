package net.vortexdevelopment.vwire.exception;

import java.lang.reflect.Type;

/**
 * Thrown when a registration call is invalid, e.g. an open generic service mapped to a closed implementation.
 */
public class ConfigurationException extends DependencyContainerException {

    public ConfigurationException(Type serviceType, String message) {
        super(serviceType, message);
    }

    public ConfigurationException(Type serviceType, String message, Throwable cause) {
        super(serviceType, message, cause);
    }
}
