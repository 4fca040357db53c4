package net.vortexdevelopment.vwire.exception;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;

/**
 * Base type of every error raised while registering or resolving services.
 */
public class DependencyContainerException extends RuntimeException {

    @Nullable
    private final Type serviceType;

    public DependencyContainerException(@Nullable Type serviceType, String message) {
        super(message);
        this.serviceType = serviceType;
    }

    public DependencyContainerException(@Nullable Type serviceType, String message, Throwable cause) {
        super(message, cause);
        this.serviceType = serviceType;
    }

    /**
     * @return the service type the failing operation was working on, or null if none applies
     */
    @Nullable
    public Type getServiceType() {
        return serviceType;
    }
}
