package dev.mars.fencestore.db.util;

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

import io.vertx.core.Future;

import java.util.concurrent.CompletableFuture;

/**
 * Bridges Vert.x futures to the {@link CompletableFuture} surface of the public API.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-16
 * @version 1.0
 */
public final class ReactiveUtils {

    private ReactiveUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static <T> CompletableFuture<T> toCompletableFuture(Future<T> future) {
        return future.toCompletionStage().toCompletableFuture();
    }

    /**
     * Message of the innermost cause, used when a failure is folded into an error result.
     */
    public static String describe(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null ? root.getClass().getSimpleName() : message;
    }
}
