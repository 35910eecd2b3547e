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
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Statements the JDBC stores issue. Subclasses map them to concrete table layout and SQL dialect.
 * <p>Statements returned are closed by the caller. Methods reading from a result set expect the result set produced
 * by corresponding select statement of the same schema.</p>
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    /**
     * Prepare a statement and bind positional parameters. Supports the parameter types the stores pass: strings,
     * integral numbers, instants and null.
     */
    protected static PreparedStatement prepare(Connection connection, String sql, Object... params)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                bind(st, i + 1, params[i]);
            }
        } catch (SQLException | RuntimeException e) {
            st.close();
            throw e;
        }
        return st;
    }

    protected static void bind(PreparedStatement st, int index, Object value) throws SQLException {
        if (value == null) {
            st.setNull(index, Types.VARCHAR);
        } else if (value instanceof String) {
            st.setString(index, (String) value);
        } else if (value instanceof Long) {
            st.setLong(index, (Long) value);
        } else if (value instanceof Integer) {
            st.setInt(index, (Integer) value);
        } else if (value instanceof Instant) {
            st.setTimestamp(index, Timestamp.from((Instant) value));
        } else {
            throw new IllegalArgumentException("Cannot bind " + value + " to parameter " + index);
        }
    }

    protected abstract PreparedStatement selectEntityVersion(Connection connection, String entityId)
            throws SQLException;

    protected abstract PreparedStatement createEntityVersion(Connection connection, String entityId,
            long startVersion) throws SQLException;

    protected abstract long readEntityVersion(ResultSet rs) throws SQLException;

    /**
     * Conditional update of the entity version, that must update no rows when current version differs from
     * {@code startVersion}.
     */
    protected abstract PreparedStatement updateEventVersion(Connection connection, String entityId,
            long startVersion, long endVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, String entityId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, int payloadVersion,
            String payload) throws SQLException;

    /**
     * Select events of an entity ordered by version.
     */
    protected abstract PreparedStatement selectEvents(Connection connection, String entityId, long afterVersion)
            throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract Instant readEventTimestamp(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;

    /**
     * Select snapshots of an entity, newest first.
     */
    protected abstract PreparedStatement selectSnapshots(Connection connection, String entityId)
            throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, String entityId, long stateVersion,
            int payloadVersion, String payload) throws SQLException;

    /**
     * Select versions of stored snapshots of an entity, newest first.
     */
    protected abstract PreparedStatement selectSnapshotVersions(Connection connection, String entityId)
            throws SQLException;

    /**
     * Delete snapshots of an entity with version lower or equal to given one.
     */
    protected abstract PreparedStatement deleteSnapshotsUpTo(Connection connection, String entityId,
            long stateVersion) throws SQLException;

    protected abstract SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException;

    protected abstract String readSnapshotPayload(ResultSet rs) throws SQLException;
}
