package dev.mars.fencestore.lock;

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

import dev.mars.fencestore.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class GuardedOutcomeTest {

    @Test
    void appliedWinsOverLiveRecordFlag() {
        assertEquals(GuardedOutcome.APPLIED, GuardedOutcome.of(true, true));
        assertEquals(GuardedOutcome.APPLIED, GuardedOutcome.of(true, false));
    }

    @Test
    void liveRecordWithoutChangeIsTokenMismatch() {
        assertEquals(GuardedOutcome.TOKEN_MISMATCH, GuardedOutcome.of(false, true));
        assertEquals(GuardedOutcome.NOT_FOUND, GuardedOutcome.of(false, false));
    }

    @Test
    void scriptRepliesDecode() {
        assertEquals(GuardedOutcome.APPLIED, GuardedOutcome.fromScriptReply(1));
        assertEquals(GuardedOutcome.TOKEN_MISMATCH, GuardedOutcome.fromScriptReply(0));
        assertEquals(GuardedOutcome.NOT_FOUND, GuardedOutcome.fromScriptReply(-1));
        assertThrows(IllegalStateException.class, () -> GuardedOutcome.fromScriptReply(2));
    }
}
