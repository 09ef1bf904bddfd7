package io.github.drompincen.turnstile.persistence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.persistence.StorageUnavailableException;
import io.github.drompincen.turnstile.persistence.document.EventDocument;
import io.github.drompincen.turnstile.protocol.event.AgentMessageData;
import io.github.drompincen.turnstile.protocol.event.Event;
import io.github.drompincen.turnstile.protocol.event.EventType;
import io.github.drompincen.turnstile.protocol.event.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoEventStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private IndexOperations indexOps;

    private MongoEventStore store;

    @BeforeEach
    void setUp() {
        when(mongoTemplate.indexOps(EventDocument.class)).thenReturn(indexOps);
        store = new MongoEventStore(mongoTemplate, new ObjectMapper());
    }

    @Test
    void uniqueThreadSeqIndexIsCreatedOnStartup() {
        ArgumentCaptor<IndexDefinition> captor = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(indexOps).ensureIndex(captor.capture());

        IndexDefinition index = captor.getValue();
        assertThat(index.getIndexKeys().keySet()).containsExactly("threadId", "seq");
        assertThat(index.getIndexOptions().get("unique")).isEqualTo(true);
        assertThat(index.getIndexOptions().get("name")).isEqualTo("thread_seq");
    }

    @Test
    void indexFailureBecomesStorageUnavailable() {
        when(indexOps.ensureIndex(any(IndexDefinition.class)))
                .thenThrow(new DataAccessResourceFailureException("not primary"));

        assertThatThrownBy(() -> new MongoEventStore(mongoTemplate, new ObjectMapper()))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("not primary");
    }

    @Test
    void appendStoresPayloadAsJson() {
        Event event = new Event("e1", "t1", 3, EventType.AGENT_MESSAGE, Instant.now(),
                new AgentMessageData("hello", new TokenUsage(100, 50, 150)));

        store.append(event);

        ArgumentCaptor<EventDocument> captor = ArgumentCaptor.forClass(EventDocument.class);
        verify(mongoTemplate).insert(captor.capture());
        EventDocument doc = captor.getValue();
        assertThat(doc.getThreadId()).isEqualTo("t1");
        assertThat(doc.getSeq()).isEqualTo(3);
        assertThat(doc.getType()).isEqualTo(EventType.AGENT_MESSAGE);
        assertThat(doc.getDataJson()).contains("\"totalTokens\":150");
    }

    @Test
    void readRestoresTypedPayload() {
        EventDocument doc = new EventDocument();
        doc.setEventId("e1");
        doc.setThreadId("t1");
        doc.setSeq(1);
        doc.setType(EventType.AGENT_MESSAGE);
        doc.setDataJson("{\"content\":\"hi\",\"tokenUsage\":{\"promptTokens\":1,\"completionTokens\":2,\"totalTokens\":3}}");
        when(mongoTemplate.find(any(Query.class), eq(EventDocument.class))).thenReturn(List.of(doc));

        List<Event> events = store.read("t1");

        assertThat(events).hasSize(1);
        AgentMessageData data = events.get(0).dataAs(AgentMessageData.class);
        assertThat(data.content()).isEqualTo("hi");
        assertThat(data.tokenUsage()).isEqualTo(new TokenUsage(1, 2, 3));
    }

    @Test
    void absentUsageStaysAbsent() {
        EventDocument doc = new EventDocument();
        doc.setEventId("e1");
        doc.setThreadId("t1");
        doc.setSeq(1);
        doc.setType(EventType.AGENT_MESSAGE);
        doc.setDataJson("{\"content\":\"hi\"}");
        when(mongoTemplate.find(any(Query.class), eq(EventDocument.class))).thenReturn(List.of(doc));

        assertThat(store.read("t1").get(0).dataAs(AgentMessageData.class).tokenUsage()).isNull();
    }

    @Test
    void lastSeqIsZeroForEmptyThread() {
        when(mongoTemplate.findOne(any(Query.class), eq(EventDocument.class))).thenReturn(null);

        assertThat(store.lastSeq("t1")).isZero();
    }

    @Test
    void engineFailureBecomesStorageUnavailable() {
        when(mongoTemplate.find(any(Query.class), eq(EventDocument.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.read("t1"))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void duplicateSeqIsRejected() {
        when(mongoTemplate.insert(any(EventDocument.class))).thenThrow(new DuplicateKeyException("dup"));

        Event event = new Event("e1", "t1", 1, null, Instant.now(), new AgentMessageData("x"));

        assertThatThrownBy(() -> store.append(event))
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("Duplicate seq 1");
    }
}
