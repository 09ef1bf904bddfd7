package io.github.drompincen.turnstile.persistence.document;

import io.github.drompincen.turnstile.protocol.event.EventType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "events")
@CompoundIndex(name = "thread_seq", def = "{'threadId': 1, 'seq': 1}", unique = true)
public class EventDocument {

    @Id
    private String eventId;
    private String threadId;
    private long seq;
    private EventType type;
    private String dataJson;
    private Instant timestamp;

    public EventDocument() {}

    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public EventType getType() { return type; }
    public void setType(EventType type) { this.type = type; }

    public String getDataJson() { return dataJson; }
    public void setDataJson(String dataJson) { this.dataJson = dataJson; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
}
