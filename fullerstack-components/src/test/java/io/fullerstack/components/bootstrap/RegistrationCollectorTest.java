package io.fullerstack.components.bootstrap;

import io.fullerstack.components.Greeters.EnglishGreeter;
import io.fullerstack.components.Greeters.Greeter;
import io.fullerstack.components.registry.ComponentFactory;
import io.fullerstack.components.registry.Registration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RegistrationCollectorTest {

    private static Registration greeter(String name) {
        return Registration.of(name, "greeter", ComponentFactory.of(Greeter.class, EnglishGreeter::new));
    }

    @Test
    void shouldKeepSubmissionsInOrderUntilDrained() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("b"));
        collector.submit(greeter("a"));

        assertThat(collector.pendingCount()).isEqualTo(2);
        assertThat(collector.isDrained()).isFalse();
        assertThat(collector.drain()).extracting(Registration::name).containsExactly("b", "a");
        assertThat(collector.isDrained()).isTrue();
    }

    @Test
    void shouldRefuseSubmissionsAfterDrain() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("early"));

        collector.drain();

        assertThat(collector.pendingCount()).isZero();
        assertThatThrownBy(() -> collector.submit(greeter("late")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("late");
    }

    @Test
    void shouldReopenWithDrainedRegistrationsFirstAfterRestore() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("first"));
        collector.submit(greeter("second"));

        List<Registration> taken = collector.drain();
        collector.restore(taken);
        collector.submit(greeter("third"));

        assertThat(collector.isDrained()).isFalse();
        assertThat(collector.drain()).extracting(Registration::name)
            .containsExactly("first", "second", "third");
    }

    @Test
    void shouldRejectNullRegistration() {
        RegistrationCollector collector = new RegistrationCollector();

        assertThatThrownBy(() -> collector.submit(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldExposeOneSharedCollector() {
        assertThat(RegistrationCollector.shared()).isSameAs(RegistrationCollector.shared());
    }
}
