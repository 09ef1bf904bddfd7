package io.github.drompincen.turnstile.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.store.EventStore;
import io.github.drompincen.turnstile.persistence.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistenceContextTest {

    private PersistenceContext context;

    @BeforeEach
    void setUp() {
        context = new PersistenceContext(new ObjectMapper());
    }

    @Test
    void getBeforeInitFailsFast() {
        assertThatThrownBy(() -> context.get())
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("not initialized");
    }

    @Test
    void memoryLocatorSelectsInMemoryStore() {
        context.init("memory:");

        assertThat(context.get()).isInstanceOf(InMemoryEventStore.class);
        assertThat(context.isInitialized()).isTrue();
        assertThat(context.locator()).isEqualTo("memory:");
    }

    @Test
    void resetDropsTheHandle() {
        context.init("memory:test");
        context.reset();

        assertThat(context.isInitialized()).isFalse();
        assertThatThrownBy(() -> context.get()).isInstanceOf(StorageUnavailableException.class);
    }

    @Test
    void reinitReplacesStore() {
        context.init("memory:");
        EventStore first = context.get();
        first.createThread("t1");

        context.init("memory:");

        assertThat(context.get()).isNotSameAs(first);
        assertThat(context.get().threadExists("t1")).isFalse();
    }

    @Test
    void unknownLocatorIsRejected() {
        assertThatThrownBy(() -> context.init("postgres://db"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> context.init(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
