package io.github.drompincen.turnstile.runtime.queue;

import java.time.Instant;

public record QueuedMessage(
        String id,
        Kind kind,
        String content,
        Instant timestamp,
        Metadata metadata
) {
    public enum Kind {
        USER,
        SYSTEM,
        TASK_NOTIFICATION
    }

    public enum Priority {
        NORMAL,
        HIGH
    }

    public record Metadata(
            String taskId,
            String fromAgent,
            Priority priority,
            String source
    ) {
        public Metadata {
            if (priority == null) {
                priority = Priority.NORMAL;
            }
        }

        public static Metadata normal(String source) {
            return new Metadata(null, null, Priority.NORMAL, source);
        }

        public static Metadata high(String source) {
            return new Metadata(null, null, Priority.HIGH, source);
        }
    }

    public QueuedMessage {
        if (metadata == null) {
            metadata = Metadata.normal(null);
        }
    }

    public Priority priority() {
        return metadata.priority();
    }
}
