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

/**
 * What a token-checked release or extend found in the backend.
 */
public enum GuardedOutcome {
    /** The record was live and carried the caller's token; the change was applied. */
    APPLIED,
    /** A live record exists under another token. */
    TOKEN_MISMATCH,
    /** No live record exists. */
    NOT_FOUND;

    public static GuardedOutcome of(boolean applied, boolean liveRecord) {
        if (applied) {
            return APPLIED;
        }
        return liveRecord ? TOKEN_MISMATCH : NOT_FOUND;
    }

    /**
     * Decodes the integer reply of the Redis lock scripts: {@code 1}, {@code 0} or {@code -1}.
     */
    public static GuardedOutcome fromScriptReply(long reply) {
        if (reply == 1L) {
            return APPLIED;
        }
        if (reply == 0L) {
            return TOKEN_MISMATCH;
        }
        if (reply == -1L) {
            return NOT_FOUND;
        }
        throw new IllegalStateException("Unexpected lock script reply: " + reply);
    }
}
