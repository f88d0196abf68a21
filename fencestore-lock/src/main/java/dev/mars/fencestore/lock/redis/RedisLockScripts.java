package dev.mars.fencestore.lock.redis;

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
 * Lua scripts run with {@code EVAL} so the token comparison and the change are atomic.
 *
 * <p>Both reply {@code 1} when applied, {@code 0} when another token holds the key and {@code -1}
 * when the key does not exist. An expired key no longer exists in Redis.</p>
 */
final class RedisLockScripts {

    static final String RELEASE = """
        local current = redis.call('GET', KEYS[1])
        if current == false then
            return -1
        elseif current == ARGV[1] then
            return redis.call('DEL', KEYS[1])
        else
            return 0
        end
        """;

    // ARGV[2] is the new TTL in milliseconds
    static final String EXTEND = """
        local current = redis.call('GET', KEYS[1])
        if current == false then
            return -1
        elseif current == ARGV[1] then
            return redis.call('PEXPIRE', KEYS[1], ARGV[2])
        else
            return 0
        end
        """;

    private RedisLockScripts() {
    }
}
