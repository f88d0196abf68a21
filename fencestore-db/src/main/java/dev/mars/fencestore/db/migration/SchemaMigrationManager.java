package dev.mars.fencestore.db.migration;

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

import dev.mars.fencestore.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Applies the bundled {@code db/migration} scripts.
 *
 * <p>All pending scripts run in a single transaction that first takes
 * {@code pg_advisory_xact_lock}, so concurrent starters serialise and a failed script leaves no
 * partial schema behind. Applied scripts are recorded in {@code schema_version} with a SHA-256
 * checksum; a script whose content changed after it was applied fails the migration.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-17
 * @version 1.0
 */
public class SchemaMigrationManager {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMigrationManager.class);

    static final long MIGRATION_LOCK_ID = 0x46454E43L; // "FENC"

    static final List<String> MIGRATION_FILES = List.of(
        "V001__Create_Lock_Table.sql",
        "V002__Create_Event_Tables.sql"
    );

    private final PgConnectionManager connectionManager;
    private final String serviceId;
    private final String schema;
    private final String migrationPath;
    private final boolean validateChecksums;

    public SchemaMigrationManager(PgConnectionManager connectionManager, String serviceId, String schema) {
        this(connectionManager, serviceId, schema, "/db/migration", true);
    }

    public SchemaMigrationManager(PgConnectionManager connectionManager, String serviceId, String schema,
                                  String migrationPath, boolean validateChecksums) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.serviceId = serviceId;
        this.schema = schema;
        this.migrationPath = Objects.requireNonNull(migrationPath, "migrationPath");
        this.validateChecksums = validateChecksums;
    }

    /**
     * Applies all pending migrations.
     *
     * @return future with the number of scripts applied
     */
    public Future<Integer> migrate() {
        List<MigrationScript> available = getAvailableMigrations();
        logger.debug("Starting database migration with {} bundled scripts", available.size());

        return connectionManager.withTransaction(serviceId, connection ->
            connection.preparedQuery("SELECT pg_advisory_xact_lock($1)").execute(Tuple.of(MIGRATION_LOCK_ID))
                .compose(v -> ensureSchema(connection))
                .compose(v -> ensureSchemaVersionTable(connection))
                .compose(v -> getAppliedChecksums(connection))
                .compose(applied -> {
                    List<MigrationScript> pending = selectPending(available, applied);
                    Future<Integer> chain = Future.succeededFuture(0);
                    for (MigrationScript migration : pending) {
                        chain = chain.compose(count -> applyMigration(migration, connection)
                            .map(v -> {
                                logger.info("Applied migration {} ({})", migration.getVersion(), migration.getDescription());
                                return count + 1;
                            }));
                    }
                    return chain;
                }))
            .onSuccess(count -> logger.info("Migration completed, {} scripts applied", count))
            .recover(error -> {
                logger.error("Database migration failed: {}", error.getMessage());
                return Future.failedFuture(new RuntimeException("Database migration failed", error));
            });
    }

    private Future<Void> ensureSchema(SqlConnection connection) {
        if (schema == null || schema.isBlank() || "public".equals(schema)) {
            return Future.succeededFuture();
        }
        if (!schema.matches("[A-Za-z0-9_]+")) {
            return Future.failedFuture(new IllegalArgumentException("Invalid schema name: " + schema));
        }
        return connection.query("CREATE SCHEMA IF NOT EXISTS " + schema).execute().mapEmpty();
    }

    private Future<Void> ensureSchemaVersionTable(SqlConnection connection) {
        String sql = """
            CREATE TABLE IF NOT EXISTS schema_version (
                version VARCHAR(50) PRIMARY KEY,
                description TEXT,
                applied_at TIMESTAMP WITH TIME ZONE DEFAULT NOW(),
                checksum VARCHAR(64)
            )
            """;
        return connection.query(sql).execute().mapEmpty();
    }

    private Future<Map<String, String>> getAppliedChecksums(SqlConnection connection) {
        return connection.query("SELECT version, checksum FROM schema_version").execute()
            .map(rowSet -> {
                Map<String, String> applied = new HashMap<>();
                for (Row row : rowSet) {
                    applied.put(row.getString("version"), row.getString("checksum"));
                }
                return applied;
            });
    }

    List<MigrationScript> selectPending(List<MigrationScript> available, Map<String, String> applied) {
        List<MigrationScript> pending = new ArrayList<>();
        for (MigrationScript script : available) {
            String recorded = applied.get(script.getVersion());
            if (recorded == null) {
                pending.add(script);
            } else if (validateChecksums && !recorded.equals(script.getChecksum())) {
                throw new IllegalStateException("Checksum mismatch for applied migration " + script.getVersion()
                    + ": recorded " + recorded + ", bundled " + script.getChecksum());
            }
        }
        pending.sort(Comparator.comparing(MigrationScript::getVersion));
        return pending;
    }

    private Future<Void> applyMigration(MigrationScript migration, SqlConnection connection) {
        // Simple query protocol, so a script may hold several statements
        return connection.query(migration.getContent()).execute()
            .compose(v -> connection
                .preparedQuery("INSERT INTO schema_version (version, description, checksum) VALUES ($1, $2, $3)")
                .execute(Tuple.of(migration.getVersion(), migration.getDescription(), migration.getChecksum())))
            .<Void>mapEmpty()
            .recover(error -> Future.failedFuture(
                new RuntimeException("Migration failed: " + migration.getVersion(), error)));
    }

    List<MigrationScript> getAvailableMigrations() {
        List<MigrationScript> scripts = new ArrayList<>();
        for (String fileName : MIGRATION_FILES) {
            String content = loadResourceAsString(migrationPath + "/" + fileName);
            if (content == null) {
                throw new IllegalStateException("Migration script missing from classpath: " + fileName);
            }
            // V001__Create_Lock_Table.sql -> version V001, description "Create Lock Table"
            String version = fileName.substring(0, fileName.indexOf("__"));
            String description = fileName.substring(fileName.indexOf("__") + 2, fileName.lastIndexOf(".sql"))
                .replace("_", " ");
            scripts.add(new MigrationScript(version, description, content, calculateChecksum(content)));
        }
        return scripts;
    }

    private String loadResourceAsString(String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is == null) {
                return null;
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read migration resource: " + resourcePath, e);
        }
    }

    static String calculateChecksum(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public static class MigrationScript {
        private final String version;
        private final String description;
        private final String content;
        private final String checksum;

        public MigrationScript(String version, String description, String content, String checksum) {
            this.version = version;
            this.description = description;
            this.content = content;
            this.checksum = checksum;
        }

        public String getVersion() { return version; }
        public String getDescription() { return description; }
        public String getContent() { return content; }
        public String getChecksum() { return checksum; }
    }
}
