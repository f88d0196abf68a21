package dev.mars.fencestore.eventstore;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.fencestore.api.events.EventEnvelope;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.NewEvent;
import dev.mars.fencestore.api.events.Snapshot;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import dev.mars.fencestore.memory.InMemoryEventStore;
import dev.mars.fencestore.memory.InMemorySnapshotStore;
import dev.mars.fencestore.test.categories.TestCategories;
import dev.mars.fencestore.test.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class StreamReplayerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final StreamId ACCOUNT = StreamId.of("account-42");

    private MutableClock clock;
    private InMemoryEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private StreamReplayer replayer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        eventStore = new InMemoryEventStore(clock);
        snapshotStore = new InMemorySnapshotStore();
        replayer = new StreamReplayer(eventStore, snapshotStore, clock);
    }

    @AfterEach
    void tearDown() {
        eventStore.close();
        snapshotStore.close();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static NewEvent deposit(int amount) {
        return NewEvent.of("Deposited", MAPPER.createObjectNode().put("amount", amount));
    }

    private static ObjectNode balance(int total) {
        return MAPPER.createObjectNode().put("balance", total);
    }

    private CompletableFuture<Result<Integer, EventStoreError>> foldBalance() {
        return replayer.fold(ACCOUNT,
            snapshot -> snapshot.map(s -> s.state().get("balance").asInt()).orElse(0),
            (total, event) -> total + event.payload().get("amount").asInt());
    }

    @Test
    void replayWithoutSnapshotReturnsWholeStream() throws Exception {
        await(eventStore.append(ACCOUNT, List.of(deposit(10), deposit(5))));

        ReplayedStream replayed = await(replayer.replay(ACCOUNT)).value();

        assertTrue(replayed.snapshot().isEmpty());
        assertEquals(2, replayed.events().size());
        assertEquals(2L, replayed.version());
        assertEquals(15, await(foldBalance()).value());
    }

    @Test
    void replayStartsAfterLatestSnapshot() throws Exception {
        await(eventStore.append(ACCOUNT, List.of(deposit(10), deposit(5), deposit(1))));
        await(replayer.takeSnapshot(ACCOUNT, 2, "Account", balance(15)));
        await(eventStore.append(ACCOUNT, List.of(deposit(100))));

        ReplayedStream replayed = await(replayer.replay(ACCOUNT)).value();

        assertEquals(2L, replayed.snapshot().orElseThrow().version());
        assertEquals(List.of(3L, 4L), replayed.events().stream().map(EventEnvelope::version).collect(Collectors.toList()));
        assertEquals(4L, replayed.version());
        assertEquals(116, await(foldBalance()).value());
    }

    @Test
    void snapshotAtHeadLeavesNoTail() throws Exception {
        await(eventStore.append(ACCOUNT, List.of(deposit(10))));
        await(replayer.takeSnapshot(ACCOUNT, 1, "Account", balance(10)));

        ReplayedStream replayed = await(replayer.replay(ACCOUNT)).value();

        assertEquals(List.of(), replayed.events());
        assertEquals(1L, replayed.version());
    }

    @Test
    void unknownStreamReplaysEmpty() throws Exception {
        ReplayedStream replayed = await(replayer.replay(StreamId.of("nobody"))).value();

        assertTrue(replayed.isEmpty());
        assertEquals(0L, replayed.version());
    }

    @Test
    void takeSnapshotStampsClockAndSaves() throws Exception {
        await(eventStore.append(ACCOUNT, List.of(deposit(10), deposit(5))));

        Snapshot taken = await(replayer.takeSnapshot(ACCOUNT, 2, "Account", balance(15))).value();

        assertEquals(Instant.parse("2025-06-01T10:00:00Z"), taken.createdAt());
        assertEquals(Optional.of(taken), await(snapshotStore.loadSnapshot(ACCOUNT)).value());
    }

    @Test
    void takeSnapshotRejectsEmptyStreamAndFutureVersions() throws Exception {
        assertEquals(new EventStoreError.StreamNotFound(ACCOUNT),
            await(replayer.takeSnapshot(ACCOUNT, 1, null, balance(0))).error());

        await(eventStore.append(ACCOUNT, List.of(deposit(10))));

        assertEquals(new EventStoreError.SnapshotRejected(ACCOUNT, 5, 1),
            await(replayer.takeSnapshot(ACCOUNT, 5, null, balance(10))).error());
        assertEquals(Optional.empty(), await(snapshotStore.loadSnapshot(ACCOUNT)).value());
    }

    @Test
    void invalidSnapshotArgumentsAreRejectedSynchronously() {
        assertThrows(IllegalArgumentException.class, () -> replayer.takeSnapshot(ACCOUNT, 0, null, balance(0)));
        assertThrows(NullPointerException.class, () -> replayer.takeSnapshot(ACCOUNT, 1, null, null));
        assertThrows(NullPointerException.class, () -> replayer.replay(null));
    }
}
