package dev.mars.fencestore.api.events;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class EventQueryTest {

    private static final StreamId STREAM = StreamId.of("orders-1");

    @Test
    void testDefaults() {
        EventQuery query = EventQuery.forStream(STREAM);

        assertEquals(1L, query.fromVersion());
        assertNull(query.toVersion());
        assertNull(query.eventType());
        assertEquals(1, query.page());
        assertEquals(EventQuery.DEFAULT_PAGE_SIZE, query.pageSize());
        assertEquals(0L, query.offset());
    }

    @Test
    void testPageClamping() {
        assertEquals(EventQuery.MAX_PAGE_SIZE, EventQuery.forStream(STREAM).page(1, 1000).pageSize());
        assertEquals(1, EventQuery.forStream(STREAM).page(1, 0).pageSize());
        assertEquals(1, EventQuery.forStream(STREAM).page(-3, 10).page());
        assertEquals(20L, EventQuery.forStream(STREAM).page(3, 10).offset());
    }

    @Test
    void testVersionRange() {
        EventQuery query = EventQuery.forStream(STREAM).fromVersion(0).toVersion(5);

        assertEquals(1L, query.fromVersion());
        assertEquals(5L, query.toVersion());
        assertThrows(IllegalArgumentException.class,
            () -> EventQuery.forStream(STREAM).fromVersion(10).toVersion(5));
    }

    @Test
    void testPageHasNext() {
        EventEnvelope envelope = new EventEnvelope(UUID.randomUUID(), STREAM, 1, "Created",
            JsonNodeFactory.instance.objectNode(), null, Instant.now());
        EventQuery query = EventQuery.forStream(STREAM).page(1, 1);

        assertTrue(EventPage.of(query, List.of(envelope), 2).hasNext());
        assertFalse(EventPage.of(query.page(2, 1), List.of(envelope), 2).hasNext());
    }

    @Test
    void testStreamIdAndEventValidation() {
        assertThrows(IllegalArgumentException.class, () -> StreamId.of(""));
        assertThrows(NullPointerException.class, () -> NewEvent.of("Created", null));
        assertThrows(IllegalArgumentException.class,
            () -> NewEvent.of(" ", JsonNodeFactory.instance.objectNode()));
        assertEquals(EventMetadata.empty(),
            new NewEvent("Created", JsonNodeFactory.instance.objectNode(), null).metadata());
        assertThrows(IllegalArgumentException.class,
            () -> EventStreams.requireEvents(List.of()));
    }

    @Test
    void testMetadataHeadersAreCopied() {
        EventMetadata metadata = EventMetadata.correlated("corr-1", "cause-1")
            .withActor("user-7")
            .withHeader("source", "test");

        assertEquals("corr-1", metadata.correlationId());
        assertEquals("cause-1", metadata.causationId());
        assertEquals("user-7", metadata.actorId());
        assertEquals("test", metadata.headers().get("source"));
        assertThrows(UnsupportedOperationException.class, () -> metadata.headers().put("x", "y"));
    }
}
