package io.github.drompincen.turnstile.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.store.EventStore;
import io.github.drompincen.turnstile.persistence.store.InMemoryEventStore;
import io.github.drompincen.turnstile.persistence.store.MongoEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

/**
 * Owns the storage handle. Built explicitly and handed to whoever needs it; {@link #get()} fails
 * fast until {@link #init(String)} has been called.
 *
 * <p>Locators: {@code memory:} for a process-local store, {@code mongodb://host/db} or
 * {@code mongodb+srv://...} for MongoDB.
 */
public class PersistenceContext {

    private static final Logger log = LoggerFactory.getLogger(PersistenceContext.class);

    private final ObjectMapper objectMapper;
    private volatile EventStore store;
    private volatile String locator;

    public PersistenceContext(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public synchronized void init(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("Persistence locator must not be blank");
        }
        reset();
        if (locator.startsWith("memory:")) {
            this.store = new InMemoryEventStore();
        } else if (locator.startsWith("mongodb://") || locator.startsWith("mongodb+srv://")) {
            this.store = openMongo(locator);
        } else {
            throw new IllegalArgumentException("Unsupported persistence locator: " + locator);
        }
        this.locator = locator;
        log.info("Persistence initialized with {}", locator.startsWith("memory:") ? locator : "mongodb");
    }

    /** Installs an already-built store, e.g. one backed by an application-managed MongoTemplate. */
    public synchronized void init(EventStore eventStore) {
        reset();
        this.store = eventStore;
        this.locator = eventStore.getClass().getSimpleName();
    }

    public synchronized void reset() {
        EventStore current = this.store;
        this.store = null;
        this.locator = null;
        if (current != null) {
            current.close();
        }
    }

    public EventStore get() {
        EventStore current = this.store;
        if (current == null) {
            throw new StorageUnavailableException("Persistence not initialized");
        }
        return current;
    }

    public boolean isInitialized() {
        return store != null;
    }

    public String locator() {
        return locator;
    }

    private EventStore openMongo(String connectionString) {
        SimpleMongoClientDatabaseFactory factory = null;
        try {
            factory = new SimpleMongoClientDatabaseFactory(connectionString);
            SimpleMongoClientDatabaseFactory client = factory;
            return new MongoEventStore(new MongoTemplate(factory), objectMapper, () -> close(client));
        } catch (RuntimeException e) {
            if (factory != null) {
                close(factory);
            }
            throw new StorageUnavailableException("Cannot open MongoDB store: " + e.getMessage(), e);
        }
    }

    private static void close(SimpleMongoClientDatabaseFactory factory) {
        try {
            factory.destroy();
        } catch (Exception e) {
            log.warn("Failed to close MongoDB client: {}", e.getMessage());
        }
    }
}
