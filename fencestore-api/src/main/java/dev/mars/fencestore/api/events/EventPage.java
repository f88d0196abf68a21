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

import java.util.List;

/**
 * One page of a filtered stream read.
 *
 * @param events     events of this page in version order
 * @param page       the 1-based page number
 * @param pageSize   the effective page size
 * @param totalCount number of events matching the filter across all pages
 * @param hasNext    whether a later page holds more events
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public record EventPage(
    List<EventEnvelope> events,
    int page,
    int pageSize,
    long totalCount,
    boolean hasNext
) {
    public EventPage {
        events = List.copyOf(events);
    }

    public static EventPage of(EventQuery query, List<EventEnvelope> events, long totalCount) {
        boolean hasNext = (long) query.page() * query.pageSize() < totalCount;
        return new EventPage(events, query.page(), query.pageSize(), totalCount, hasNext);
    }
}
