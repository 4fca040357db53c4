package net.vortexdevelopment.vwire.config;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable snapshot of the tunables a {@link net.vortexdevelopment.vwire.di.DependencyContainer} reads once at creation.
 */
@Getter
public final class ContainerSettings {

    public static final String CACHE_CLOSED_GENERICS = "vwire.generics.cache-closed";
    public static final String STRICT_SCOPE_CLOSE = "vwire.scope.strict-close";

    /**
     * Whether synthesized (closed generic and implicit) registrations are reused across lookups.
     */
    private final boolean cacheClosedGenerics;

    /**
     * Whether resolving through a closed lifetime scope is rejected.
     */
    private final boolean strictScopeClose;

    private ContainerSettings(Builder builder) {
        this.cacheClosedGenerics = builder.cacheClosedGenerics;
        this.strictScopeClose = builder.strictScopeClose;
    }

    public static ContainerSettings defaults() {
        return builder().build();
    }

    /**
     * Read settings from the shared {@link Environment}.
     */
    public static ContainerSettings fromEnvironment() {
        return fromEnvironment(Environment.getInstance());
    }

    public static ContainerSettings fromEnvironment(@NotNull Environment environment) {
        return builder()
                .cacheClosedGenerics(environment.getPropertyAsBoolean(CACHE_CLOSED_GENERICS, true))
                .strictScopeClose(environment.getPropertyAsBoolean(STRICT_SCOPE_CLOSE, true))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean cacheClosedGenerics = true;
        private boolean strictScopeClose = true;

        public Builder cacheClosedGenerics(boolean cacheClosedGenerics) {
            this.cacheClosedGenerics = cacheClosedGenerics;
            return this;
        }

        public Builder strictScopeClose(boolean strictScopeClose) {
            this.strictScopeClose = strictScopeClose;
            return this;
        }

        public ContainerSettings build() {
            return new ContainerSettings(this);
        }
    }
}
