package io.github.drompincen.turnstile.persistence.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.StorageUnavailableException;
import io.github.drompincen.turnstile.persistence.document.EventDocument;
import io.github.drompincen.turnstile.persistence.document.ThreadDocument;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventData;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.CompoundIndexDefinition;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Stores events in the {@code events} collection with the payload serialized as a JSON string,
 * the same way checkpoints were stored. Payloads are read back into the record named by the
 * event type.
 */
public class MongoEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(MongoEventStore.class);
    static final String SEQ_INDEX = "thread_seq";

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Runnable onClose;

    public MongoEventStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, () -> {});
    }

    public MongoEventStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Runnable onClose) {
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
        this.onClose = onClose;
        ensureIndexes();
    }

    /**
     * Index auto-creation is off by default in Spring Data MongoDB, so the unique per-thread seq
     * index that rejects a second writer is created here.
     */
    private void ensureIndexes() {
        String name = call("ensureIndexes", () -> mongoTemplate.indexOps(EventDocument.class).ensureIndex(
                new CompoundIndexDefinition(new Document("threadId", 1).append("seq", 1))
                        .named(SEQ_INDEX)
                        .unique()));
        log.debug("Ensured index {} on events", name);
    }

    @Override
    public void createThread(String threadId) {
        call("createThread", () -> mongoTemplate.upsert(
                byId(threadId),
                new Update().setOnInsert("createdAt", Instant.now()),
                ThreadDocument.class));
    }

    @Override
    public boolean threadExists(String threadId) {
        return call("threadExists", () -> mongoTemplate.exists(byId(threadId), ThreadDocument.class));
    }

    @Override
    public List<String> threadIds() {
        return call("threadIds", () -> mongoTemplate.findAll(ThreadDocument.class).stream()
                .map(ThreadDocument::getThreadId)
                .toList());
    }

    @Override
    public void append(Event event) {
        EventDocument doc = new EventDocument();
        doc.setEventId(event.id());
        doc.setThreadId(event.threadId());
        doc.setSeq(event.seq());
        doc.setType(event.type());
        doc.setTimestamp(event.timestamp());
        doc.setDataJson(writeData(event.data()));
        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            throw new StorageUnavailableException(
                    "Duplicate seq " + event.seq() + " for thread " + event.threadId(), e);
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to append event to thread " + event.threadId(), e);
        }
    }

    @Override
    public List<Event> read(String threadId) {
        Query query = Query.query(Criteria.where("threadId").is(threadId))
                .with(Sort.by(Sort.Direction.ASC, "seq"));
        return call("read", () -> mongoTemplate.find(query, EventDocument.class)).stream()
                .map(this::toEvent)
                .toList();
    }

    @Override
    public long lastSeq(String threadId) {
        Query query = Query.query(Criteria.where("threadId").is(threadId))
                .with(Sort.by(Sort.Direction.DESC, "seq"))
                .limit(1);
        EventDocument last = call("lastSeq", () -> mongoTemplate.findOne(query, EventDocument.class));
        return last == null ? 0 : last.getSeq();
    }

    @Override
    public void purge(String threadId) {
        call("purge", () -> {
            mongoTemplate.remove(Query.query(Criteria.where("threadId").is(threadId)), EventDocument.class);
            return mongoTemplate.remove(byId(threadId), ThreadDocument.class);
        });
        log.info("Purged thread {}", threadId);
    }

    @Override
    public void clear() {
        call("clear", () -> {
            mongoTemplate.remove(new Query(), EventDocument.class);
            return mongoTemplate.remove(new Query(), ThreadDocument.class);
        });
    }

    @Override
    public void close() {
        onClose.run();
    }

    private Event toEvent(EventDocument doc) {
        try {
            EventData data = objectMapper.readValue(doc.getDataJson(), doc.getType().dataClass());
            return new Event(doc.getEventId(), doc.getThreadId(), doc.getSeq(), doc.getType(), doc.getTimestamp(), data);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException(
                    "Corrupt payload for event " + doc.getEventId() + " in thread " + doc.getThreadId(), e);
        }
    }

    private String writeData(EventData data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable: " + data.type(), e);
        }
    }

    private static Query byId(String threadId) {
        return Query.query(Criteria.where("_id").is(threadId));
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Event store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
