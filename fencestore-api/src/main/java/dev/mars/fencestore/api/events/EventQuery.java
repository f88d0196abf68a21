package dev.mars.fencestore.api.events;

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

import java.util.Objects;

/**
 * Filter and page selection for {@link EventStore#read(EventQuery)}.
 *
 * <p>Pages are 1-based; page numbers below 1 are raised to 1 and page sizes are clamped into
 * {@code 1..MAX_PAGE_SIZE}. {@code toVersion} is inclusive and optional, {@code eventType} matches
 * exactly when present.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public record EventQuery(
    StreamId streamId,
    long fromVersion,
    Long toVersion,
    String eventType,
    int page,
    int pageSize
) {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 200;

    public EventQuery {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        fromVersion = Math.max(1L, fromVersion);
        page = Math.max(1, page);
        pageSize = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
        if (toVersion != null && toVersion < fromVersion) {
            throw new IllegalArgumentException("toVersion " + toVersion + " is before fromVersion " + fromVersion);
        }
    }

    public static EventQuery forStream(StreamId streamId) {
        return new EventQuery(streamId, 1L, null, null, 1, DEFAULT_PAGE_SIZE);
    }

    public EventQuery fromVersion(long version) {
        return new EventQuery(streamId, version, toVersion, eventType, page, pageSize);
    }

    public EventQuery toVersion(long version) {
        return new EventQuery(streamId, fromVersion, version, eventType, page, pageSize);
    }

    public EventQuery eventType(String type) {
        return new EventQuery(streamId, fromVersion, toVersion, type, page, pageSize);
    }

    public EventQuery page(int pageNumber, int size) {
        return new EventQuery(streamId, fromVersion, toVersion, eventType, pageNumber, size);
    }

    /**
     * Number of matching events skipped before this page.
     */
    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
