package io.github.drompincen.turnstile.persistence.store;

import io.github.drompincen.turnstile.persistence.StorageUnavailableException;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.UserMessageData;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventStoreTest {

    private final InMemoryEventStore store = new InMemoryEventStore();

    @Test
    void appendKeepsOrderAndTracksLastSeq() {
        store.append(event("t1", 1, "a"));
        store.append(event("t1", 2, "b"));

        assertThat(store.read("t1")).extracting(Event::seq).containsExactly(1L, 2L);
        assertThat(store.lastSeq("t1")).isEqualTo(2);
        assertThat(store.threadExists("t1")).isTrue();
    }

    @Test
    void duplicateSeqIsRejected() {
        store.append(event("t1", 1, "a"));

        assertThatThrownBy(() -> store.append(event("t1", 1, "again")))
                .isInstanceOf(StorageUnavailableException.class);
        assertThat(store.read("t1")).hasSize(1);
    }

    @Test
    void unknownThreadReadsEmpty() {
        assertThat(store.read("missing")).isEmpty();
        assertThat(store.lastSeq("missing")).isZero();
    }

    @Test
    void purgeRemovesThread() {
        store.createThread("t1");
        store.append(event("t1", 1, "a"));

        store.purge("t1");

        assertThat(store.threadExists("t1")).isFalse();
        assertThat(store.read("t1")).isEmpty();
    }

    private static Event event(String threadId, long seq, String text) {
        return new Event("e" + seq, threadId, seq, null, Instant.now(), new UserMessageData(text));
    }
}
