package net.vortexdevelopment.vwire.di.module;

import net.vortexdevelopment.vwire.config.ContainerSettings;
import net.vortexdevelopment.vwire.di.DependencyContainer;
import net.vortexdevelopment.vwire.di.registry.Lifetime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleTest {

    @Test
    void moduleRegistrationsAreApplied() {
        DependencyContainer container = new DependencyContainer(ContainerSettings.defaults());

        container.registerModule(new MessagingModule());

        assertThat(container.resolve(Transport.class)).isInstanceOf(InMemoryTransport.class);
        assertThat(container.resolve(Transport.class)).isSameAs(container.resolve(Transport.class));
    }

    @Test
    void moduleIsLoadedOnce() {
        DependencyContainer container = new DependencyContainer(ContainerSettings.defaults());
        MessagingModule module = new MessagingModule();

        container.registerModule(module);
        container.registerModule(module);

        assertThat(module.loads).isEqualTo(1);
    }

    @Test
    void separateInstancesOfAModuleAreLoadedSeparately() {
        DependencyContainer container = new DependencyContainer(ContainerSettings.defaults());
        MessagingModule first = new MessagingModule();
        MessagingModule second = new MessagingModule();

        container.registerModule(first);
        container.registerModule(second);

        assertThat(first.loads).isEqualTo(1);
        assertThat(second.loads).isEqualTo(1);
    }

    @Test
    void moduleCanLoadOtherModules() {
        DependencyContainer container = new DependencyContainer(ContainerSettings.defaults());

        container.registerModule(new ApplicationModule());

        assertThat(container.isRegistered(Transport.class)).isTrue();
    }

    public interface Transport {
    }

    public static class InMemoryTransport implements Transport {
    }

    public static class MessagingModule extends Module {
        private int loads;

        @Override
        public void load(DependencyContainer container) {
            loads++;
            container.register(Transport.class, InMemoryTransport.class, Lifetime.SINGLETON);
        }
    }

    public static class ApplicationModule extends Module {
        @Override
        public void load(DependencyContainer container) {
            container.registerModule(new MessagingModule());
        }
    }
}
