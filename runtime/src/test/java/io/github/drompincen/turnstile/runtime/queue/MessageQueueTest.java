package io.github.drompincen.turnstile.runtime.queue;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class MessageQueueTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final MessageQueue queue = new MessageQueue(clock);

    @Test
    void highPriorityFirstThenArrivalOrder() {
        queue.enqueue(QueuedMessage.Kind.USER, "A", QueuedMessage.Metadata.normal("user"));
        queue.enqueue(QueuedMessage.Kind.TASK_NOTIFICATION, "B", QueuedMessage.Metadata.high("task_system"));
        queue.enqueue(QueuedMessage.Kind.USER, "C", QueuedMessage.Metadata.normal("user"));

        assertThat(queue.dequeueNext()).map(QueuedMessage::content).contains("B");
        assertThat(queue.dequeueNext()).map(QueuedMessage::content).contains("A");
        assertThat(queue.dequeueNext()).map(QueuedMessage::content).contains("C");
        assertThat(queue.dequeueNext()).isEmpty();
    }

    @Test
    void statsReportLengthAgeAndHighPriorityCount() {
        queue.enqueue(QueuedMessage.Kind.USER, "A", null);
        clock.advance(Duration.ofSeconds(2));
        queue.enqueue(QueuedMessage.Kind.SYSTEM, "B", QueuedMessage.Metadata.high("system"));
        clock.advance(Duration.ofSeconds(3));

        QueueStats stats = queue.stats();

        assertThat(stats.queueLength()).isEqualTo(2);
        assertThat(stats.highPriorityCount()).isEqualTo(1);
        assertThat(stats.oldestMessageAge()).isEqualTo(5000L);
    }

    @Test
    void emptyQueueHasNoOldestAge() {
        QueueStats stats = queue.stats();

        assertThat(stats.queueLength()).isZero();
        assertThat(stats.oldestMessageAge()).isNull();
    }

    @Test
    void clearWithFilterRemovesMatchingOnly() {
        queue.enqueue(QueuedMessage.Kind.USER, "A", null);
        queue.enqueue(QueuedMessage.Kind.TASK_NOTIFICATION, "B", QueuedMessage.Metadata.high("task_system"));
        queue.enqueue(QueuedMessage.Kind.USER, "C", null);

        int removed = queue.clear(m -> m.kind() == QueuedMessage.Kind.USER);

        assertThat(removed).isEqualTo(2);
        assertThat(queue.contents()).extracting(QueuedMessage::content).containsExactly("B");
    }

    @Test
    void eachMessageIsDequeuedOnce() {
        String id = queue.enqueue(QueuedMessage.Kind.USER, "only", null);

        Optional<QueuedMessage> first = queue.dequeueNext();

        assertThat(first).map(QueuedMessage::id).contains(id);
        assertThat(queue.dequeueNext()).isEmpty();
        assertThat(queue.isEmpty()).isTrue();
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
