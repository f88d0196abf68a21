package dev.mars.fencestore.db.metrics;

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

import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.lock.LockError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for lock and event store operations.
 *
 * <p>Recording before {@link #bindTo(MeterRegistry)} is a no-op, so backends can hold an
 * instance whether or not metrics are enabled.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-11
 * @version 1.0
 */
public class FenceStoreMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(FenceStoreMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    private Counter locksAcquired;
    private Counter locksContended;
    private Counter locksReleased;
    private Counter locksExtended;
    private Counter lockTokenMismatches;
    private Counter locksNotFound;
    private Counter eventsAppended;
    private Counter versionConflicts;

    public FenceStoreMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * An instance that is never bound and records nothing.
     */
    public static FenceStoreMetrics disabled() {
        return new FenceStoreMetrics("disabled");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        locksAcquired = Counter.builder("fencestore.lock.acquired")
            .description("Locks granted")
            .tag("instance", instanceId)
            .register(registry);

        locksContended = Counter.builder("fencestore.lock.contended")
            .description("Acquire attempts rejected because the lock was held")
            .tag("instance", instanceId)
            .register(registry);

        locksReleased = Counter.builder("fencestore.lock.released")
            .description("Locks released by their holder")
            .tag("instance", instanceId)
            .register(registry);

        locksExtended = Counter.builder("fencestore.lock.extended")
            .description("Lock leases extended by their holder")
            .tag("instance", instanceId)
            .register(registry);

        lockTokenMismatches = Counter.builder("fencestore.lock.token_mismatch")
            .description("Release or extend attempts carrying a stale token")
            .tag("instance", instanceId)
            .register(registry);

        locksNotFound = Counter.builder("fencestore.lock.not_found")
            .description("Release or extend attempts on an absent or expired lock")
            .tag("instance", instanceId)
            .register(registry);

        eventsAppended = Counter.builder("fencestore.events.appended")
            .description("Events written to streams")
            .tag("instance", instanceId)
            .register(registry);

        versionConflicts = Counter.builder("fencestore.events.version_conflicts")
            .description("Appends rejected by the expected-version check")
            .tag("instance", instanceId)
            .register(registry);

        this.registry = registry;
        logger.info("FenceStore metrics registered for instance: {}", instanceId);
    }

    public boolean isBound() {
        return registry != null;
    }

    public void recordLockAcquired() {
        increment(locksAcquired);
    }

    public void recordLockReleased() {
        increment(locksReleased);
    }

    public void recordLockExtended() {
        increment(locksExtended);
    }

    /**
     * Counts a failed lock operation under the meter matching its variant.
     */
    public void recordLockError(String operation, LockError error) {
        if (error instanceof LockError.AlreadyLocked) {
            increment(locksContended);
        } else if (error instanceof LockError.TokenMismatch) {
            increment(lockTokenMismatches);
        } else if (error instanceof LockError.LockNotFound) {
            increment(locksNotFound);
        } else {
            recordBackendError(operation);
        }
    }

    public void recordEventsAppended(int count) {
        if (eventsAppended != null) {
            eventsAppended.increment(count);
        }
    }

    public void recordEventStoreError(String operation, EventStoreError error) {
        if (error instanceof EventStoreError.VersionConflict) {
            increment(versionConflicts);
        } else if (error instanceof EventStoreError.ConnectionFailed
                || error instanceof EventStoreError.DeserializationError) {
            recordBackendError(operation);
        }
    }

    public void recordBackendError(String operation) {
        MeterRegistry current = registry;
        if (current != null) {
            Counter.builder("fencestore.backend.errors")
                .description("Backend failures surfaced as error results")
                .tag("instance", instanceId)
                .tag("operation", operation)
                .register(current)
                .increment();
        }
    }

    /**
     * Starts timing an operation; pass the result to {@link #recordLockOperation} or
     * {@link #recordEventOperation}.
     */
    public long startTimer() {
        return System.nanoTime();
    }

    public void recordLockOperation(String operation, long startNanos) {
        recordTimer("fencestore.lock.operation.time", operation, startNanos);
    }

    public void recordEventOperation(String operation, long startNanos) {
        recordTimer("fencestore.events.operation.time", operation, startNanos);
    }

    private void recordTimer(String name, String operation, long startNanos) {
        MeterRegistry current = registry;
        if (current != null) {
            Timer.builder(name)
                .tag("instance", instanceId)
                .tag("operation", operation)
                .register(current)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
