package io.github.cartly.engine.store.jdbc;

/*-
 * #%L
 * cartly
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.cartly.engine.Event;
import io.github.cartly.engine.store.SnapshotMetadata;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Three tables per entity type:
 * <ul>
 * <li>events {@code (ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD)}, keyed by ID and VERSION</li>
 * <li>versions {@code (ID, VERSION)}, keyed by ID, holding the latest event version of each entity</li>
 * <li>snapshots {@code (ID, VERSION, CREATED_AT, PAYLOAD_VERSION, PAYLOAD)}, keyed by ID and VERSION</li>
 * </ul>
 * The version row is what appends lock on, the primary key of the event table catches any writer that slips past it.
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String versionTable;
    private final String snapshotTable;

    private final String selectVersionSql;
    private final String insertVersionSql;
    private final String updateVersionSql;
    private final String insertEventSql;
    private final String selectEventsSql;
    private final String selectSnapshotsSql;
    private final String insertSnapshotSql;
    private final String selectSnapshotVersionsSql;
    private final String deleteSnapshotsSql;

    public DefaultJdbcSchema(String eventTable, String versionTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.versionTable = versionTable;
        this.snapshotTable = snapshotTable;

        selectVersionSql = "SELECT VERSION FROM " + versionTable + " WHERE ID = ?";
        insertVersionSql = "INSERT INTO " + versionTable + " (ID, VERSION) VALUES (?, ?)";
        updateVersionSql = "UPDATE " + versionTable + " SET VERSION = ? WHERE ID = ? AND VERSION = ?";
        insertEventSql = "INSERT INTO " + eventTable
                + " (ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD) VALUES (?, ?, ?, ?, ?, ?)";
        selectEventsSql = "SELECT ID, VERSION, CREATED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD FROM " + eventTable
                + " WHERE ID = ? AND VERSION > ? ORDER BY VERSION";
        selectSnapshotsSql = "SELECT ID, VERSION, CREATED_AT, PAYLOAD_VERSION, PAYLOAD FROM " + snapshotTable
                + " WHERE ID = ? ORDER BY VERSION DESC";
        insertSnapshotSql = "INSERT INTO " + snapshotTable
                + " (ID, VERSION, CREATED_AT, PAYLOAD_VERSION, PAYLOAD) VALUES (?, ?, ?, ?, ?)";
        selectSnapshotVersionsSql = "SELECT VERSION FROM " + snapshotTable + " WHERE ID = ? ORDER BY VERSION DESC";
        deleteSnapshotsSql = "DELETE FROM " + snapshotTable + " WHERE ID = ? AND VERSION <= ?";
    }

    /**
     * Tables named after the entity type, {@code forEntity("cart")} uses CART_EVENT, CART_VERSION and CART_SNAPSHOT.
     */
    public static DefaultJdbcSchema forEntity(String entityName) {
        String prefix = entityName.toUpperCase();
        return new DefaultJdbcSchema(prefix + "_EVENT", prefix + "_VERSION", prefix + "_SNAPSHOT");
    }

    /**
     * DDL for the three tables. Plain SQL that H2 and most databases accept.
     */
    public String[] createTableStatements() {
        return new String[] {
            "CREATE TABLE " + eventTable + " (ID VARCHAR(255) NOT NULL, VERSION BIGINT NOT NULL, "
                    + "CREATED_AT TIMESTAMP NOT NULL, TYPE VARCHAR(255) NOT NULL, PAYLOAD_VERSION INT NOT NULL, "
                    + "PAYLOAD CLOB, PRIMARY KEY (ID, VERSION))",
            "CREATE TABLE " + versionTable + " (ID VARCHAR(255) NOT NULL PRIMARY KEY, VERSION BIGINT NOT NULL)",
            "CREATE TABLE " + snapshotTable + " (ID VARCHAR(255) NOT NULL, VERSION BIGINT NOT NULL, "
                    + "CREATED_AT TIMESTAMP NOT NULL, PAYLOAD_VERSION INT NOT NULL, PAYLOAD CLOB, "
                    + "PRIMARY KEY (ID, VERSION))"
        };
    }

    @Override
    protected PreparedStatement selectEntityVersion(Connection connection, String entityId) throws SQLException {
        return prepare(connection, selectVersionSql, entityId);
    }

    @Override
    protected PreparedStatement createEntityVersion(Connection connection, String entityId, long startVersion)
            throws SQLException {
        return prepare(connection, insertVersionSql, entityId, startVersion);
    }

    @Override
    protected long readEntityVersion(ResultSet rs) throws SQLException {
        return rs.getLong("VERSION");
    }

    @Override
    protected PreparedStatement updateEventVersion(Connection connection, String entityId, long startVersion,
            long endVersion) throws SQLException {
        return prepare(connection, updateVersionSql, endVersion, entityId, startVersion);
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, String entityId) throws SQLException {
        return connection.prepareStatement(insertEventSql);
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion, String payload)
            throws SQLException {
        Object[] row = {event.entityId(), event.entityStateVersion(), event.getTimestamp(), event.getType(),
            payloadVersion, payload};
        for (int i = 0; i < row.length; i++) {
            bind(insertEvent, i + 1, row[i]);
        }
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String entityId, long afterVersion)
            throws SQLException {
        return prepare(connection, selectEventsSql, entityId, afterVersion);
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong("VERSION");
    }

    @Override
    protected Instant readEventTimestamp(ResultSet rs) throws SQLException {
        return rs.getTimestamp("CREATED_AT").toInstant();
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString("TYPE");
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt("PAYLOAD_VERSION");
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString("PAYLOAD");
    }

    @Override
    protected PreparedStatement selectSnapshots(Connection connection, String entityId) throws SQLException {
        return prepare(connection, selectSnapshotsSql, entityId);
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, String entityId, long stateVersion,
            int payloadVersion, String payload) throws SQLException {
        return prepare(connection, insertSnapshotSql, entityId, stateVersion, Instant.now(), payloadVersion, payload);
    }

    @Override
    protected PreparedStatement selectSnapshotVersions(Connection connection, String entityId) throws SQLException {
        return prepare(connection, selectSnapshotVersionsSql, entityId);
    }

    @Override
    protected PreparedStatement deleteSnapshotsUpTo(Connection connection, String entityId, long stateVersion)
            throws SQLException {
        return prepare(connection, deleteSnapshotsSql, entityId, stateVersion);
    }

    @Override
    protected SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException {
        return SnapshotMetadata.of(rs.getString("ID"), rs.getTimestamp("CREATED_AT").toInstant(),
            rs.getInt("PAYLOAD_VERSION"), rs.getLong("VERSION"));
    }

    @Override
    protected String readSnapshotPayload(ResultSet rs) throws SQLException {
        return rs.getString("PAYLOAD");
    }
}
