package net.vortexdevelopment.vwire.di;

import net.vortexdevelopment.vwire.config.ContainerSettings;
import net.vortexdevelopment.vwire.di.registry.Lifetime;
import net.vortexdevelopment.vwire.exception.ConstructionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for resolving every registration of a service as a collection.
 */
class CollectionResolutionTest {

    private static final TypeKey<List<Plugin>> PLUGIN_LIST = new TypeKey<>() {};

    private DependencyContainer container;

    @BeforeEach
    void setUp() {
        container = new DependencyContainer(ContainerSettings.defaults());
    }

    @Test
    void listContainsUnkeyedAndKeyedRegistrationsInOrder() {
        // Arrange
        container.register(Plugin.class, CorePlugin.class);
        container.register(Plugin.class, MetricsPlugin.class, Lifetime.TRANSIENT, "metrics");
        container.register(Plugin.class, AuditPlugin.class, Lifetime.TRANSIENT, "audit");

        // Act
        List<Plugin> plugins = container.resolve(PLUGIN_LIST);

        // Assert
        assertThat(plugins).hasSize(3);
        assertThat(plugins).extracting(Plugin::name).containsExactly("core", "metrics", "audit");
    }

    @Test
    void listIsEmptyWhenNothingIsRegistered() {
        assertThat(container.resolve(PLUGIN_LIST)).isEmpty();
        assertThat(container.resolveAll(Plugin.class)).isEmpty();
    }

    @Test
    void listIsUnmodifiable() {
        container.register(Plugin.class, CorePlugin.class);

        List<Plugin> plugins = container.resolve(PLUGIN_LIST);

        assertThatThrownBy(() -> plugins.add(new AuditPlugin())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void collectionsAreInjectedIntoConstructors() {
        container.register(Plugin.class, MetricsPlugin.class, Lifetime.SINGLETON, "metrics");
        container.register(Plugin.class, AuditPlugin.class, Lifetime.TRANSIENT, "audit");

        PluginManager manager = container.resolve(PluginManager.class);

        assertThat(manager.plugins).extracting(Plugin::name).containsExactly("metrics", "audit");
        assertThat(manager.iterable).hasSize(2);
        assertThat(manager.wildcard).hasSize(2);
        assertThat(manager.plugins.get(0)).isSameAs(container.resolve(Plugin.class, "metrics"));
    }

    @Test
    void resolveAllMatchesListResolution() {
        container.register(Plugin.class, CorePlugin.class);
        container.register(Plugin.class, AuditPlugin.class, Lifetime.TRANSIENT, "audit");

        assertThat(container.resolveAll(Plugin.class)).extracting(Plugin::name).containsExactly("core", "audit");
    }

    @Test
    void exactListRegistrationWins() {
        container.register(Plugin.class, CorePlugin.class);
        container.register(PLUGIN_LIST, repository -> List.of(new AuditPlugin()), Lifetime.TRANSIENT);

        assertThat(container.resolve(PLUGIN_LIST)).extracting(Plugin::name).containsExactly("audit");
    }

    @Test
    void elementConstructionFailuresPropagate() {
        container.register(Plugin.class, BrokenPlugin.class, Lifetime.TRANSIENT, "broken");

        assertThatThrownBy(() -> container.resolve(PLUGIN_LIST)).isInstanceOf(ConstructionException.class);
    }

    public interface Plugin {
        String name();
    }

    public static class CorePlugin implements Plugin {
        @Override
        public String name() {
            return "core";
        }
    }

    public static class MetricsPlugin implements Plugin {
        @Override
        public String name() {
            return "metrics";
        }
    }

    public static class AuditPlugin implements Plugin {
        @Override
        public String name() {
            return "audit";
        }
    }

    public static class BrokenPlugin implements Plugin {
        public BrokenPlugin() {
            throw new IllegalStateException("broken");
        }

        @Override
        public String name() {
            return "broken";
        }
    }

    public static class PluginManager {
        private final List<Plugin> plugins;
        private final Iterable<Plugin> iterable;
        private final Collection<? extends Plugin> wildcard;

        public PluginManager(List<Plugin> plugins, Iterable<Plugin> iterable, Collection<? extends Plugin> wildcard) {
            this.plugins = plugins;
            this.iterable = iterable;
            this.wildcard = wildcard;
        }
    }
}
