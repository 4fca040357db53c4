package net.vortexdevelopment.vwire.di;

import net.vortexdevelopment.vwire.annotation.Inject;
import net.vortexdevelopment.vwire.config.ContainerSettings;
import net.vortexdevelopment.vwire.di.registry.Lifetime;
import net.vortexdevelopment.vwire.di.registry.RegistrationFactory;
import net.vortexdevelopment.vwire.exception.ConfigurationException;
import net.vortexdevelopment.vwire.exception.ConstructionException;
import net.vortexdevelopment.vwire.exception.NotRegisteredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for registration and resolution through the container.
 */
class DependencyContainerTest {

    private DependencyContainer container;

    @BeforeEach
    void setUp() {
        container = new DependencyContainer(ContainerSettings.defaults());
    }

    @Test
    void resolvesRegisteredImplementation() {
        container.register(Greeter.class, EnglishGreeter.class);

        Greeter greeter = container.resolve(Greeter.class);

        assertThat(greeter).isInstanceOf(EnglishGreeter.class);
        assertThat(greeter.greet()).isEqualTo("Hello");
    }

    @Test
    void transientRegistrationReturnsNewInstanceEachTime() {
        container.register(Greeter.class, EnglishGreeter.class, Lifetime.TRANSIENT);

        assertThat(container.resolve(Greeter.class)).isNotSameAs(container.resolve(Greeter.class));
    }

    @Test
    void singletonRegistrationReturnsSameInstance() {
        container.register(Greeter.class, EnglishGreeter.class, Lifetime.SINGLETON);

        assertThat(container.resolve(Greeter.class)).isSameAs(container.resolve(Greeter.class));
    }

    @Test
    void registeredInstanceIsReturnedAsIs() {
        EnglishGreeter instance = new EnglishGreeter();
        container.registerInstance(Greeter.class, instance);

        assertThat(container.resolve(Greeter.class)).isSameAs(instance);
    }

    @Test
    void laterRegistrationOverwritesEarlierOne() {
        container.register(Greeter.class, EnglishGreeter.class);
        container.register(Greeter.class, GermanGreeter.class);

        assertThat(container.resolve(Greeter.class)).isInstanceOf(GermanGreeter.class);
    }

    @Test
    void constructorDependenciesAreResolvedTransitively() {
        container.register(Greeter.class, GermanGreeter.class, Lifetime.SINGLETON);

        WelcomeService service = container.resolve(WelcomeService.class);

        assertThat(service.greeter).isSameAs(container.resolve(Greeter.class));
        assertThat(service.welcome("Anna")).isEqualTo("Hallo, Anna");
    }

    @Test
    void concreteClassesResolveWithoutRegistration() {
        // Arrange & Act
        Clock first = container.resolve(Clock.class);
        Clock second = container.resolve(Clock.class);

        // Assert: implicit registrations are transient
        assertThat(first).isNotNull();
        assertThat(first).isNotSameAs(second);
    }

    @Test
    void unregisteredInterfaceIsReported() {
        assertThatThrownBy(() -> container.resolve(Greeter.class))
                .isInstanceOf(NotRegisteredException.class)
                .hasMessageContaining(Greeter.class.getName())
                .hasMessageContaining("is not registered");
    }

    @Test
    void missingConstructorDependencySurfacesAsNotRegistered() {
        assertThatThrownBy(() -> container.resolve(WelcomeService.class))
                .isInstanceOf(NotRegisteredException.class)
                .satisfies(e -> assertThat(((NotRegisteredException) e).getServiceType()).isEqualTo(Greeter.class));
    }

    @Test
    void valueTypesAreNotBuiltImplicitly() {
        assertThatThrownBy(() -> container.resolve(String.class)).isInstanceOf(NotRegisteredException.class);
        assertThatThrownBy(() -> container.resolve(Integer.class)).isInstanceOf(NotRegisteredException.class);
    }

    @Test
    void keyedRegistrationsAreResolvedByKey() {
        container.register(Greeter.class, EnglishGreeter.class, Lifetime.TRANSIENT, "A");
        container.register(Greeter.class, GermanGreeter.class, Lifetime.TRANSIENT, "B");

        assertThat(container.resolve(Greeter.class, "A")).isInstanceOf(EnglishGreeter.class);
        assertThat(container.resolve(Greeter.class, "B")).isInstanceOf(GermanGreeter.class);
        assertThatThrownBy(() -> container.resolve(Greeter.class, "C"))
                .isInstanceOf(NotRegisteredException.class)
                .hasMessageContaining("with key 'C'");
    }

    @Test
    void keyedLookupWithoutAnyKeyedRegistrationIsReported() {
        container.register(Greeter.class, EnglishGreeter.class);

        assertThatThrownBy(() -> container.resolve(Greeter.class, "A"))
                .isInstanceOf(NotRegisteredException.class)
                .hasMessageContaining("No keyed registrations found");
    }

    @Test
    void keyedRegistrationsAreInvisibleToUnkeyedResolution() {
        container.register(Greeter.class, EnglishGreeter.class, Lifetime.TRANSIENT, "A");

        assertThatThrownBy(() -> container.resolve(Greeter.class)).isInstanceOf(NotRegisteredException.class);
    }

    @Test
    void overridesReplaceConstructorArgumentsByName() {
        // Arrange
        container.register(Greeter.class, EnglishGreeter.class);

        // Act
        ReportService service = container.resolve(ReportService.class, Map.of("connectionString", "jdbc:h2:mem:reports"));

        // Assert
        assertThat(service.connectionString).isEqualTo("jdbc:h2:mem:reports");
        assertThat(service.greeter).isInstanceOf(EnglishGreeter.class);
    }

    @Test
    void overridesOnlyApplyToTheRequestedService() {
        container.register(Greeter.class, EnglishGreeter.class);

        assertThatThrownBy(() -> container.resolve(ReportClient.class, Map.of("connectionString", "jdbc:h2:mem:reports")))
                .isInstanceOf(NotRegisteredException.class)
                .satisfies(e -> assertThat(((NotRegisteredException) e).getServiceType()).isEqualTo(String.class));
    }

    @Test
    void singletonFactoryIsInvokedOnce() {
        AtomicInteger calls = new AtomicInteger();
        container.register(Greeter.class, repository -> {
            calls.incrementAndGet();
            return new EnglishGreeter();
        }, Lifetime.SINGLETON);

        Greeter first = container.resolve(Greeter.class);
        Greeter second = container.resolve(Greeter.class);

        assertThat(first).isSameAs(second);
        assertThat(calls).hasValue(1);
    }

    @Test
    void factoryCanResolveOtherServices() {
        container.register(Greeter.class, GermanGreeter.class);
        container.register(WelcomeService.class, repository -> new WelcomeService(repository.resolve(Greeter.class)), Lifetime.TRANSIENT);

        assertThat(container.resolve(WelcomeService.class).welcome("Jan")).isEqualTo("Hallo, Jan");
    }

    @Test
    void factoryReturningNullFails() {
        container.register(Greeter.class, repository -> null, Lifetime.TRANSIENT);

        assertThatThrownBy(() -> container.resolve(Greeter.class))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("returned null");
    }

    @Test
    void factoryExceptionIsWrapped() {
        container.register(Greeter.class, repository -> {
            throw new IllegalStateException("offline");
        }, Lifetime.TRANSIENT);

        assertThatThrownBy(() -> container.resolve(Greeter.class))
                .isInstanceOf(ConstructionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void throwingConstructorIsReportedWithCause() {
        assertThatThrownBy(() -> container.resolve(FailingService.class))
                .isInstanceOf(ConstructionException.class)
                .hasRootCauseMessage("boom");
    }

    @Test
    void classWithoutPublicConstructorCannotBeBuilt() {
        assertThatThrownBy(() -> container.resolve(HiddenConstructor.class))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("No public constructors found");
    }

    @Test
    void widestConstructorIsSelected() {
        container.register(Greeter.class, EnglishGreeter.class);

        MultiConstructorService service = container.resolve(MultiConstructorService.class);

        assertThat(service.greeter).isNotNull();
        assertThat(service.clock).isNotNull();
    }

    @Test
    void containerIsAvailableAsDependency() {
        assertThat(container.resolve(DependencyRepository.class)).isSameAs(container);
        assertThat(container.resolve(ContainerAware.class).repository).isSameAs(container);
    }

    @Test
    void invalidRegistrationsAreRejected() {
        assertThatThrownBy(() -> container.register(Greeter.class, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> container.register(Greeter.class, EnglishGreeter.class, Lifetime.TRANSIENT, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> container.registerInstance(Greeter.class, null))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> container.register(Greeter.class, (RegistrationFactory<Greeter>) null, Lifetime.TRANSIENT))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> container.register(Greeter.class, AbstractGreeter.class))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("concrete class");
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void implementationMustBeAssignableToService() {
        Class raw = Clock.class;

        assertThatThrownBy(() -> container.register(Greeter.class, raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("is not assignable");
    }

    @Test
    void isRegisteredReportsExplicitRegistrationsOnly() {
        container.register(Greeter.class, EnglishGreeter.class, Lifetime.TRANSIENT, "en");

        assertThat(container.isRegistered(Greeter.class)).isFalse();
        assertThat(container.isRegistered(Greeter.class, "en")).isTrue();
        assertThat(container.isRegistered(Clock.class)).isFalse();

        container.resolve(Clock.class);
        assertThat(container.isRegistered(Clock.class)).isFalse();
    }

    @Test
    void externallyCreatedObjectsCanBeInjected() {
        container.register(Greeter.class, EnglishGreeter.class);
        ExternalComponent component = new ExternalComponent();

        container.inject(component);

        assertThat(component.greeter).isInstanceOf(EnglishGreeter.class);
    }

    public interface Greeter {
        String greet();
    }

    public static class EnglishGreeter implements Greeter {
        @Override
        public String greet() {
            return "Hello";
        }
    }

    public static class GermanGreeter implements Greeter {
        @Override
        public String greet() {
            return "Hallo";
        }
    }

    public abstract static class AbstractGreeter implements Greeter {
    }

    public static class Clock {
    }

    public static class WelcomeService {
        private final Greeter greeter;

        public WelcomeService(Greeter greeter) {
            this.greeter = greeter;
        }

        public String welcome(String name) {
            return greeter.greet() + ", " + name;
        }
    }

    public static class ReportService {
        private final Greeter greeter;
        private final String connectionString;

        public ReportService(Greeter greeter, String connectionString) {
            this.greeter = greeter;
            this.connectionString = connectionString;
        }
    }

    public static class ReportClient {
        public ReportClient(ReportService reportService) {
        }
    }

    public static class FailingService {
        public FailingService() {
            throw new IllegalStateException("boom");
        }
    }

    public static class HiddenConstructor {
        private HiddenConstructor() {
        }
    }

    public static class MultiConstructorService {
        private Greeter greeter;
        private Clock clock;

        public MultiConstructorService() {
        }

        public MultiConstructorService(Greeter greeter) {
            this.greeter = greeter;
        }

        public MultiConstructorService(Greeter greeter, Clock clock) {
            this.greeter = greeter;
            this.clock = clock;
        }
    }

    public static class ContainerAware {
        private final DependencyRepository repository;

        public ContainerAware(DependencyRepository repository) {
            this.repository = repository;
        }
    }

    public static class ExternalComponent {
        @Inject
        private Greeter greeter;
    }
}
