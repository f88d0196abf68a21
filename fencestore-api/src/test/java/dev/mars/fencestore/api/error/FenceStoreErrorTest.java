package dev.mars.fencestore.api.error;

import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.lock.LockError;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class FenceStoreErrorTest {

    @Test
    void testFromLockError() {
        FenceStoreError error = FenceStoreError.from(new LockError.AlreadyLocked("order:42"));

        assertEquals(FenceStoreErrorCodes.LOCK_ALREADY_HELD, error.code());
        assertTrue(error.message().contains("order:42"));
        assertNull(error.details());
        assertNotNull(error.timestamp());
    }

    @Test
    void testFromInternalLockErrorKeepsCause() {
        FenceStoreError error = FenceStoreError.from(
            LockError.Internal.of("order:42", new IllegalStateException("connection reset")));

        assertEquals(FenceStoreErrorCodes.LOCK_BACKEND_FAILURE, error.code());
        assertTrue(error.details().contains("connection reset"));
    }

    @Test
    void testFromVersionConflict() {
        EventStoreError conflict = new EventStoreError.VersionConflict(StreamId.of("s1"), 0, 1);
        FenceStoreError error = FenceStoreError.from(conflict);

        assertEquals(FenceStoreErrorCodes.EVENT_VERSION_CONFLICT, error.code());
        assertEquals("Version conflict on stream 's1': expected 0, actual 1", error.message());
        assertFalse(conflict.isRetryable());
    }

    @Test
    void testConnectionFailureIsRetryable() {
        EventStoreError failure = EventStoreError.ConnectionFailed.of(new RuntimeException("refused"));

        assertTrue(failure.isRetryable());
        assertEquals(FenceStoreErrorCodes.DATABASE_CONNECTION_FAILED, FenceStoreError.from(failure).code());
        assertTrue(FenceStoreError.from(failure).details().contains("refused"));
    }
}
